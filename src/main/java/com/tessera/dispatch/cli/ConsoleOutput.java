package com.tessera.dispatch.cli;

import com.tessera.core.model.AssignmentEntry;
import com.tessera.core.model.ConsensusDecision;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.WorkItem;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for Tessera CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TESSERA v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TESSERA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void consensus(ConsensusDecision decision) {
        String color = switch (decision.type()) {
            case CONSENSUS -> "fg(green)";
            case MODIFICATION_PEDAGOGICAL -> "fg(yellow)";
            case FALLBACK -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " [CONSENSUS " + decision.type() + "]|@ " + decision.structure().activityType()
                        + ", stages " + String.join(" > ", decision.structure().stages())
                        + String.format(Locale.ROOT, " (score %.2f, %s)", decision.weightedScore(), decision.verdict())));
        for (String adaptation : decision.adaptationRequirements()) {
            System.out.println("    adaptation: " + adaptation);
        }
        for (String adjustment : decision.feasibilityAdjustments()) {
            System.out.println("    adjustment: " + adjustment);
        }
    }

    public static void phase(String stage, List<WorkItem> items) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [" + stage.toUpperCase(Locale.ROOT) + "]|@ " + items.size()
                        + " item" + (items.size() != 1 ? "s" : "")));
        for (WorkItem item : items) {
            System.out.printf("  %s [%-10s c%d %3d min] %s%n", item.id(),
                    item.collaborationMode().name().toLowerCase(Locale.ROOT), item.complexity(),
                    item.estimatedDurationMinutes(), item.description());
            System.out.println("      competencies: " + String.join(", ", item.requiredCompetencies())
                    + (item.dependencies().isEmpty() ? "" : " | after: " + String.join(", ", item.dependencies())));
        }
    }

    public static void assignment(ParticipantProfile participant, List<AssignmentEntry> entries) {
        String label = participant.id() + " (" + participant.name() + ")";
        if (entries.isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|faint " + label + ": -|@"));
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|bold " + label + "|@"));
        for (AssignmentEntry entry : entries) {
            System.out.printf(Locale.ROOT, "    %s  %.2f  %s%n", entry.itemId(), entry.score(), entry.rationale());
        }
    }

    public static void participant(ParticipantProfile p, int cap) {
        System.out.printf("  %-8s %-18s %-8s %3d%%  cap %d%n", p.id(), p.name(),
                p.neurotype().name(), p.availability(), cap);
        System.out.println("           strengths: " + (p.strengths().isEmpty() ? "-" : String.join(", ", p.strengths())));
        System.out.println("           support:   " + (p.supportNeeds().isEmpty() ? "-" : String.join(", ", p.supportNeeds())));
    }
}
