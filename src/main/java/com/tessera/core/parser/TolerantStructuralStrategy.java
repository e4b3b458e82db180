package com.tessera.core.parser;

import com.tessera.core.model.WorkItemDraft;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads loosely structured lists: numbered items, bullets, markdown headers and bold
 * titles, with {@code key: value} or {@code key - value} detail lines under a wide set of
 * synonym keys. Lines that are neither start a new item nor name a known field extend the
 * current item's description.
 * <p>
 * Headers and bold titles only survive when a field line follows them, so a document
 * title above a plain list does not become an item.
 */
public class TolerantStructuralStrategy implements ParsingStrategy {

    private static final Pattern NUMBERED = Pattern.compile("^\\s{0,3}(\\d+)[.)]\\s+(.+)$");
    private static final Pattern BULLET = Pattern.compile("^\\s{0,1}[-*•+]\\s+(.+)$");
    private static final Pattern MARKDOWN_HEADER = Pattern.compile("^\\s*#{1,6}\\s+(.+)$");
    private static final Pattern BOLD_TITLE = Pattern.compile("^\\s*\\*\\*(.+?)\\*\\*\\s*:?\\s*(.*)$");

    private enum Origin { LIST, HEADER }

    private static final class Pending {
        final DraftBuilder builder;
        final Origin origin;

        Pending(DraftBuilder builder, Origin origin) {
            this.builder = builder;
            this.origin = origin;
        }

        boolean keep() {
            return builder.hasDescription() && (origin == Origin.LIST || builder.fieldCount() > 0);
        }
    }

    @Override
    public String name() {
        return "tolerant-structure";
    }

    @Override
    public ParseConfidence confidence() {
        return ParseConfidence.TOLERANT;
    }

    @Override
    public StrategyResult attempt(String rawText, ParseHints hints) {
        if (rawText == null || rawText.isBlank()) {
            return StrategyResult.failure(FailureReason.EMPTY_INPUT, "no text");
        }
        var pending = new ArrayList<Pending>();
        Pending current = null;
        for (String line : TextLines.lines(rawText)) {
            if (line.isBlank()) {
                continue;
            }
            Optional<TextLines.KeyValue> field = knownField(line);
            if (field.isPresent()) {
                DraftField key = DraftField.tolerant(field.get().key()).orElseThrow();
                boolean newDescription = key == DraftField.DESCRIPTION
                        && (current == null || current.builder.describedByField() || NUMBERED.matcher(line).matches());
                if (current == null || newDescription) {
                    current = new Pending(new DraftBuilder(String.valueOf(pending.size() + 1)), Origin.LIST);
                    pending.add(current);
                }
                current.builder.apply(key, field.get().value());
                continue;
            }
            Optional<Pending> started = startItem(line, pending.size() + 1);
            if (started.isPresent()) {
                current = started.get();
                pending.add(current);
            } else if (current != null) {
                current.builder.appendDescription(TextLines.plain(line));
            }
        }

        List<WorkItemDraft> drafts = new ArrayList<>();
        boolean anyFields = false;
        for (Pending p : pending) {
            if (p.keep()) {
                drafts.add(p.builder.build());
                anyFields |= p.builder.fieldCount() > 0;
            }
        }
        if (drafts.isEmpty()) {
            return StrategyResult.failure(FailureReason.NO_MATCH, "no list structure");
        }
        if (drafts.size() == 1 && !anyFields) {
            return StrategyResult.failure(FailureReason.NO_MATCH, "a single bare list entry is not a plan");
        }
        return StrategyResult.success(drafts);
    }

    private static Optional<TextLines.KeyValue> knownField(String line) {
        Optional<TextLines.KeyValue> colon = TextLines.colonPair(line)
                .filter(kv -> DraftField.tolerant(kv.key()).isPresent());
        if (colon.isPresent()) {
            return colon;
        }
        return TextLines.dashPair(line).filter(kv -> DraftField.tolerant(kv.key()).isPresent());
    }

    private static Optional<Pending> startItem(String line, int ordinal) {
        Optional<Matcher> header = TextLines.itemHeader(line);
        if (header.isPresent()) {
            Matcher m = header.get();
            var builder = new DraftBuilder(TextLines.headerId(m));
            builder.appendDescription(TextLines.plain(m.group(3)));
            return Optional.of(new Pending(builder, Origin.LIST));
        }
        Matcher numbered = NUMBERED.matcher(line);
        if (numbered.matches()) {
            var builder = new DraftBuilder(numbered.group(1));
            builder.appendDescription(TextLines.plain(numbered.group(2)));
            return Optional.of(new Pending(builder, Origin.LIST));
        }
        Matcher bullet = BULLET.matcher(line);
        if (bullet.matches()) {
            var builder = new DraftBuilder(String.valueOf(ordinal));
            builder.appendDescription(TextLines.plain(bullet.group(1)));
            return Optional.of(new Pending(builder, Origin.LIST));
        }
        Matcher mdHeader = MARKDOWN_HEADER.matcher(line);
        if (mdHeader.matches()) {
            var builder = new DraftBuilder(String.valueOf(ordinal));
            builder.appendDescription(TextLines.plain(mdHeader.group(1)));
            return Optional.of(new Pending(builder, Origin.HEADER));
        }
        Matcher bold = BOLD_TITLE.matcher(line);
        if (bold.matches()) {
            var builder = new DraftBuilder(String.valueOf(ordinal));
            builder.appendDescription(TextLines.plain(bold.group(1)));
            builder.appendDescription(TextLines.plain(bold.group(2)));
            return Optional.of(new Pending(builder, Origin.HEADER));
        }
        return Optional.empty();
    }
}
