package com.example.nl2cmd.risk;

import com.example.nl2cmd.model.RiskAssessment;
import com.example.nl2cmd.model.RiskMatch;
import com.example.nl2cmd.model.RiskSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Static, case-insensitive risk patterns. Every matching pattern is reported and the overall
 * severity is the most severe match.
 */
@Component
public class PatternRiskAssessor implements RiskAssessor {

    private static final List<RiskPattern> PATTERNS = List.of(
            substring("del /s", RiskSeverity.CRITICAL,
                    "Recursively deletes files and can destroy entire directories",
                    "Use 'del <specific_file>' to delete one file at a time"),
            substring("rm -rf /", RiskSeverity.CRITICAL,
                    "Deletes every file on the system",
                    "Never run this command; specify the exact directory instead"),
            substring("rm -rf", RiskSeverity.CRITICAL,
                    "Forcefully deletes a directory tree without confirmation",
                    "Use 'rm -r' for confirmation prompts or specify the exact path"),
            word("format", RiskSeverity.CRITICAL,
                    "Formats and erases an entire disk partition",
                    "Double-check the drive letter before formatting"),
            substring("mkfs", RiskSeverity.CRITICAL,
                    "Creates a new filesystem and erases all data on the partition",
                    "Ensure the correct device is specified (e.g. /dev/sdb1 not /dev/sda1)"),
            word("dd", RiskSeverity.CRITICAL,
                    "Low-level disk copy that can overwrite the wrong drive",
                    "Triple-check the 'if' and 'of' parameters before running"),
            substring("shutdown", RiskSeverity.HIGH,
                    "Shuts down the system",
                    "Save all work before executing"),
            substring("reboot", RiskSeverity.HIGH,
                    "Restarts the system immediately",
                    "Use 'shutdown -r +5' to delay five minutes"),
            substring("systemctl stop", RiskSeverity.HIGH,
                    "Stops a system service and may affect system functionality",
                    "Use 'systemctl restart' to restart instead of stopping"),
            substring("net user", RiskSeverity.HIGH,
                    "Modifies user accounts and can lock you out",
                    "Be careful when changing passwords or disabling accounts"),
            substring("chmod 777", RiskSeverity.HIGH,
                    "Gives full permissions to everyone",
                    "Use the minimal permissions needed (e.g. chmod 755)"),
            substring("del", RiskSeverity.MEDIUM,
                    "Deletes files; this cannot be undone easily",
                    "Move to the recycle bin first or back up important files"),
            substring("rm ", RiskSeverity.MEDIUM,
                    "Removes files permanently",
                    "Use 'mv file ~/.Trash' to move to trash instead"),
            substring("kill -9", RiskSeverity.MEDIUM,
                    "Force kills a process without cleanup",
                    "Try 'kill <pid>' first to allow a graceful shutdown"),
            substring("pkill", RiskSeverity.MEDIUM,
                    "Kills processes by name and may affect several processes",
                    "Check processes with 'ps aux | grep <name>' first"),
            substring("chown -R", RiskSeverity.MEDIUM,
                    "Recursively changes file ownership",
                    "Specify the exact directory to avoid unintended changes"),
            substring("firewall", RiskSeverity.LOW,
                    "Modifies firewall settings",
                    "Back up firewall rules before making changes"),
            substring("ufw", RiskSeverity.LOW,
                    "Changes firewall configuration",
                    "Test rules before applying them permanently"),
            substring("diskpart", RiskSeverity.LOW,
                    "Disk partition management tool",
                    "Use carefully; it can affect disk structure")
    );

    @Override
    public RiskAssessment assessRisk(String command) {
        if (command == null || command.isBlank()) {
            return RiskAssessment.safe();
        }
        List<RiskMatch> matches = new ArrayList<>();
        RiskSeverity highest = null;
        for (RiskPattern pattern : PATTERNS) {
            if (pattern.pattern().matcher(command).find()) {
                matches.add(new RiskMatch(pattern.keyword(), pattern.severity(),
                        pattern.explanation(), pattern.alternative()));
                if (pattern.severity().isMoreSevereThan(highest)) {
                    highest = pattern.severity();
                }
            }
        }
        return matches.isEmpty() ? RiskAssessment.safe() : new RiskAssessment(highest, matches);
    }

    private static RiskPattern substring(String keyword, RiskSeverity severity, String explanation, String alternative) {
        return new RiskPattern(keyword, Pattern.compile(Pattern.quote(keyword), Pattern.CASE_INSENSITIVE), severity, explanation, alternative);
    }

    private static RiskPattern word(String keyword, RiskSeverity severity, String explanation, String alternative) {
        return new RiskPattern(keyword, Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE),
                severity, explanation, alternative);
    }

    private record RiskPattern(String keyword, Pattern pattern, RiskSeverity severity,
                               String explanation, String alternative) {}
}
