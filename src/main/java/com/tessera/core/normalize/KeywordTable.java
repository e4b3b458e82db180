package com.tessera.core.normalize;

import com.tessera.core.model.CollaborationMode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Static category → keyword lookup used to infer collaboration mode, competency tags
 * and stage for work items whose text did not state them.
 * <p>
 * Categories are consulted in declaration order and the first match decides the
 * collaboration mode. Overlapping matches are therefore resolved by table order, which
 * is a product decision rather than a semantic one; keep the order stable unless it is
 * reviewed. Keywords only match at the start of a word ("team" matches "teams" but not
 * "steam").
 */
public final class KeywordTable {

    public static final String DEFAULT_COMPETENCY = "transversal";

    public static final String STAGE_PREPARATION = "preparation";
    public static final String STAGE_EXECUTION = "execution";
    public static final String STAGE_REFLECTION = "reflection";

    /**
     * One row of the table.
     *
     * @param name     category name
     * @param keywords lower-case keyword stems
     * @param tags     competency tags implied by the category
     * @param mode     collaboration mode implied by the category
     */
    public record Category(String name, List<String> keywords, List<String> tags, CollaborationMode mode) {
        boolean matches(String lowerText) {
            for (String keyword : keywords) {
                if (matchesKeyword(lowerText, keyword)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final List<Category> CATEGORIES = List.of(
            new Category("improvisation",
                    List.of("improvis", "role-play", "roleplay", "role play", "act out", "drama", "theatre",
                            "theater", "spontaneous", "dramatiz"),
                    List.of("improvisation", "creativity"), CollaborationMode.GROUP),
            new Category("movement",
                    List.of("movement", "move around", "station", "walk", "outdoor", "physical", "dance", "relay",
                            "scavenger", "movimiento", "circuit"),
                    List.of("movement", "dynamic"), CollaborationMode.GROUP),
            new Category("collaboration",
                    List.of("team", "group", "together", "collaborat", "discuss", "debate", "equipo", "grupo",
                            "colabor", "cooperat"),
                    List.of("collaboration"), CollaborationMode.GROUP),
            new Category("communication",
                    List.of("pair", "partner", "present", "explain", "interview", "pareja", "expon", "oral"),
                    List.of("communication"), CollaborationMode.PAIR),
            new Category("research",
                    List.of("research", "investigat", "experiment", "observ", "hypothes", "investig"),
                    List.of("research"), CollaborationMode.PAIR),
            new Category("precision",
                    List.of("measur", "calculat", "count", "accura", "precis", "fraction", "graph", "math",
                            "medir", "medición", "calcul", "fraccion", "matemátic"),
                    List.of("precision", "mathematics"), CollaborationMode.INDIVIDUAL),
            new Category("structure",
                    List.of("step by step", "step-by-step", "checklist", "sequence", "follow the", "instruction",
                            "routine", "organiz", "organis", "schedule", "paso a paso", "rutina"),
                    List.of("structure"), CollaborationMode.INDIVIDUAL),
            new Category("creativity",
                    List.of("design", "draw", "creat", "invent", "imagin", "paint", "story", "diseñ", "dibuj",
                            "crear", "cuento"),
                    List.of("creativity"), CollaborationMode.INDIVIDUAL),
            new Category("reflection",
                    List.of("reflect", "review", "evaluat", "self-assess", "journal", "feedback", "conclu",
                            "reflexi", "evalua", "metacogn"),
                    List.of("reflection"), CollaborationMode.INDIVIDUAL),
            new Category("simple",
                    List.of("simple", "basic", "easy", "warm-up", "warm up", "sencill", "fácil"),
                    List.of("simple"), CollaborationMode.INDIVIDUAL)
    );

    private static final List<String> PREPARATION_KEYWORDS = List.of(
            "prepar", "introduc", "warm-up", "warm up", "context", "set up", "setup", "get ready", "gather material",
            "preparación", "introducción");

    private static final List<String> REFLECTION_KEYWORDS = List.of(
            "reflect", "review", "evaluat", "conclu", "closing", "wrap up", "wrap-up", "cierre", "reflexi",
            "metacogn", "self-assess");

    private KeywordTable() {} // utility class

    public static List<Category> categories() {
        return CATEGORIES;
    }

    /**
     * Categories whose keywords appear in the text, in declaration order.
     */
    public static List<Category> matches(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        var matched = new ArrayList<Category>();
        for (var category : CATEGORIES) {
            if (category.matches(lower)) {
                matched.add(category);
            }
        }
        return matched;
    }

    /**
     * Mode of the first matching category.
     */
    public static Optional<CollaborationMode> inferMode(String text) {
        var matched = matches(text);
        return matched.isEmpty() ? Optional.empty() : Optional.of(matched.get(0).mode());
    }

    /**
     * Tags of every matching category, first-seen order; {@value #DEFAULT_COMPETENCY} when none match.
     */
    public static Set<String> inferCompetencies(String text) {
        var tags = new LinkedHashSet<String>();
        for (var category : matches(text)) {
            tags.addAll(category.tags());
        }
        if (tags.isEmpty()) {
            tags.add(DEFAULT_COMPETENCY);
        }
        return tags;
    }

    public static String inferStage(String text) {
        if (text == null || text.isBlank()) {
            return STAGE_EXECUTION;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : PREPARATION_KEYWORDS) {
            if (matchesKeyword(lower, keyword)) {
                return STAGE_PREPARATION;
            }
        }
        for (String keyword : REFLECTION_KEYWORDS) {
            if (matchesKeyword(lower, keyword)) {
                return STAGE_REFLECTION;
            }
        }
        return STAGE_EXECUTION;
    }

    private static boolean matchesKeyword(String lowerText, String keyword) {
        int from = 0;
        while (true) {
            int at = lowerText.indexOf(keyword, from);
            if (at < 0) {
                return false;
            }
            if (at == 0 || !Character.isLetterOrDigit(lowerText.charAt(at - 1))) {
                return true;
            }
            from = at + 1;
        }
    }
}
