package com.example.nl2cmd.model;

/** Names of literal parameters extracted from a query and used as template placeholders. */
public final class ParameterNames {

  public static final String FILENAME = "filename";
  public static final String FOLDERNAME = "foldername";
  public static final String URL = "url";
  public static final String IP = "ip";
  public static final String NUMBER = "number";
  public static final String PORT = "port";
  public static final String PATH = "path";
  public static final String EXTENSION = "extension";
  public static final String CONTENT = "content";
  public static final String PROCESS = "process";
  public static final String BRANCHNAME = "branchname";
  public static final String MESSAGE = "message";

  private ParameterNames() {}
}
