package com.example.nl2cmd.model;

/** Two-entity request such as "folder X with file Y inside". */
public record NestedOperation(String parentType, String parentName, String childType, String childName) {

  public static NestedOperation folderWithFile(String folder, String file) {
    return new NestedOperation("folder", folder, "file", file);
  }
}
