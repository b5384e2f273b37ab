package com.example.nl2cmd.template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Fallback template table used when no template resource can be read. */
final class BuiltInTemplates {

    private BuiltInTemplates() {}

    static CommandTemplateCatalog.TemplateBundle bundle() {
        CommandTemplateCatalog.TemplateBundle bundle = new CommandTemplateCatalog.TemplateBundle();
        bundle.common = common();
        bundle.windows = windows();
        bundle.linux = linux();
        return bundle;
    }

    private static Map<String, List<String>> windows() {
        Map<String, List<String>> t = new LinkedHashMap<>();
        t.put("create_file", List.of("echo. > {filename}", "type nul > {filename}", "copy nul {filename}"));
        t.put("create_file_with_content", List.of("echo {content} > {filename}"));
        t.put("create_folder", List.of("mkdir {foldername}", "md {foldername}"));
        t.put("create_nested", List.of(
                "mkdir {foldername} && echo. > {foldername}\\{filename}",
                "mkdir {foldername} && type nul > {foldername}\\{filename}"));
        t.put("delete_file", List.of("del {filename}", "del /f {filename}"));
        t.put("delete_folder", List.of("rmdir {foldername}", "rd /s /q {foldername}"));
        t.put("kill_process", List.of("taskkill /IM {process}.exe /F", "taskkill /IM {process} /F"));
        t.put("list_folder", List.of("dir {path}", "dir /b {path}"));
        return t;
    }

    private static Map<String, List<String>> linux() {
        Map<String, List<String>> t = new LinkedHashMap<>();
        t.put("create_file", List.of("touch {filename}", "> {filename}"));
        t.put("create_file_with_content", List.of("echo \"{content}\" > {filename}"));
        t.put("create_folder", List.of("mkdir {foldername}", "mkdir -p {foldername}"));
        t.put("create_nested", List.of("mkdir -p {foldername} && touch {foldername}/{filename}"));
        t.put("delete_file", List.of("rm {filename}", "rm -f {filename}"));
        t.put("delete_folder", List.of("rmdir {foldername}", "rm -rf {foldername}"));
        t.put("kill_process", List.of("pkill {process}", "killall {process}"));
        t.put("list_folder", List.of("ls {path}", "ls -la {path}"));
        return t;
    }

    private static Map<String, List<String>> common() {
        Map<String, List<String>> t = new LinkedHashMap<>();
        t.put("git_status", List.of("git status"));
        t.put("git_init", List.of("git init"));
        t.put("git_add_all", List.of("git add ."));
        t.put("git_add_file", List.of("git add {filename}"));
        t.put("git_commit", List.of("git commit -m \"{message}\""));
        t.put("git_push", List.of("git push"));
        t.put("git_push_origin", List.of("git push origin {branch}"));
        t.put("git_pull", List.of("git pull"));
        t.put("git_clone", List.of("git clone {url}"));
        t.put("git_create_branch", List.of("git branch {branchname}"));
        t.put("git_checkout", List.of("git checkout {branchname}"));
        t.put("git_checkout_new", List.of("git checkout -b {branchname}"));
        t.put("git_list_branches", List.of("git branch"));
        t.put("git_delete_branch", List.of("git branch -d {branchname}"));
        t.put("git_merge", List.of("git merge {branchname}"));
        t.put("git_log", List.of("git log"));
        t.put("git_log_short", List.of("git log --oneline"));
        t.put("git_diff", List.of("git diff"));
        t.put("git_stash", List.of("git stash"));
        t.put("git_stash_pop", List.of("git stash pop"));
        t.put("git_stash_list", List.of("git stash list"));
        t.put("git_fetch", List.of("git fetch"));
        t.put("git_add_remote", List.of("git remote add origin {url}"));
        t.put("git_list_remotes", List.of("git remote -v"));
        t.put("git_tag", List.of("git tag {tagname}"));
        t.put("git_list_tags", List.of("git tag"));
        t.put("git_push_tags", List.of("git push --tags"));
        t.put("git_config_name", List.of("git config --global user.name \"{name}\""));
        t.put("git_config_email", List.of("git config --global user.email \"{email}\""));
        t.put("git_config_list", List.of("git config --list"));
        return t;
    }
}
