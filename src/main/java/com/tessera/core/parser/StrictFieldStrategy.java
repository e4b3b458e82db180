package com.tessera.core.parser;

import com.tessera.core.model.WorkItemDraft;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the exact item format the decomposition prompt asks for: item headers
 * ({@code TASK n:}) or blank-line separated blocks, each made only of known
 * {@code Field: value} lines. Any unrecognised line inside a block rejects the whole text.
 */
public class StrictFieldStrategy implements ParsingStrategy {

    private static final Pattern SEPARATOR = Pattern.compile("^[\\s\\-=*_~]+$");

    @Override
    public String name() {
        return "strict-fields";
    }

    @Override
    public ParseConfidence confidence() {
        return ParseConfidence.STRICT;
    }

    @Override
    public StrategyResult attempt(String rawText, ParseHints hints) {
        if (rawText == null || rawText.isBlank()) {
            return StrategyResult.failure(FailureReason.EMPTY_INPUT, "no text");
        }
        List<String> lines = TextLines.lines(rawText);
        boolean hasHeaders = lines.stream().anyMatch(line -> TextLines.itemHeader(line).isPresent());
        return hasHeaders ? parseHeaderBlocks(lines) : parseBlankLineBlocks(lines);
    }

    private StrategyResult parseHeaderBlocks(List<String> lines) {
        var drafts = new ArrayList<WorkItemDraft>();
        DraftBuilder current = null;
        String title = null;
        for (String line : lines) {
            Optional<Matcher> header = TextLines.itemHeader(line);
            if (header.isPresent()) {
                if (current != null) {
                    Optional<WorkItemDraft> done = finish(current, title);
                    if (done.isEmpty()) {
                        return StrategyResult.failure(FailureReason.NO_MATCH, "block without fields or description");
                    }
                    drafts.add(done.get());
                }
                Matcher m = header.get();
                current = new DraftBuilder(TextLines.headerId(m));
                title = TextLines.plain(m.group(3));
                continue;
            }
            if (current == null || isFiller(line)) {
                continue; // preamble before the first header
            }
            if (!applyField(current, line)) {
                return StrategyResult.failure(FailureReason.NO_MATCH, "unrecognised line: " + line.trim());
            }
        }
        if (current != null) {
            Optional<WorkItemDraft> done = finish(current, title);
            if (done.isEmpty()) {
                return StrategyResult.failure(FailureReason.NO_MATCH, "block without fields or description");
            }
            drafts.add(done.get());
        }
        return StrategyResult.success(drafts);
    }

    private StrategyResult parseBlankLineBlocks(List<String> lines) {
        var drafts = new ArrayList<WorkItemDraft>();
        DraftBuilder current = null;
        for (String line : lines) {
            if (line.isBlank()) {
                if (current != null) {
                    if (!current.describedByField()) {
                        return StrategyResult.failure(FailureReason.NO_MATCH, "block without description field");
                    }
                    drafts.add(current.build());
                    current = null;
                }
                continue;
            }
            if (isFiller(line)) {
                continue;
            }
            if (current == null) {
                current = new DraftBuilder(String.valueOf(drafts.size() + 1));
            }
            if (!applyField(current, line)) {
                return StrategyResult.failure(FailureReason.NO_MATCH, "unrecognised line: " + line.trim());
            }
        }
        if (current != null) {
            if (!current.describedByField()) {
                return StrategyResult.failure(FailureReason.NO_MATCH, "block without description field");
            }
            drafts.add(current.build());
        }
        if (drafts.isEmpty()) {
            return StrategyResult.failure(FailureReason.NO_MATCH, "no field blocks");
        }
        return StrategyResult.success(drafts);
    }

    private static boolean applyField(DraftBuilder builder, String line) {
        var pair = TextLines.colonPair(line);
        if (pair.isEmpty()) {
            return false;
        }
        var field = DraftField.strict(pair.get().key());
        if (field.isEmpty()) {
            return false;
        }
        builder.apply(field.get(), pair.get().value());
        return true;
    }

    private static Optional<WorkItemDraft> finish(DraftBuilder builder, String title) {
        if (builder.fieldCount() == 0) {
            return Optional.empty();
        }
        if (!builder.describedByField()) {
            if (title == null || title.isBlank()) {
                return Optional.empty();
            }
            builder.appendDescription(title);
        }
        return Optional.of(builder.build());
    }

    private static boolean isFiller(String line) {
        return line.isBlank() || SEPARATOR.matcher(line).matches();
    }
}
