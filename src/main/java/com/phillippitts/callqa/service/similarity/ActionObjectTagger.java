package com.phillippitts.callqa.service.similarity;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code action_object} tags describing what the agent failed or managed to do to what.
 *
 * <p>Pattern shape: {@code <action verb> [to] [<capture verb>] [<qualifier>...] <object>}, e.g.
 * "missed collecting the customer's name" → {@code fail_name}. The action is normalized through
 * {@link ActionVocabulary#normalize(String)}; objects shorter than {@value #MIN_OBJECT_LENGTH}
 * characters are dropped as noise.
 */
public final class ActionObjectTagger extends AbstractPatternTagger {

    static final int MIN_OBJECT_LENGTH = 3;
    private static final int MAX_QUALIFIERS = 3;

    private final ActionVocabulary vocabulary;
    private final Pattern pattern;

    public ActionObjectTagger(ActionVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        Set<String> verbs = vocabulary.actionVerbs();
        if (verbs.isEmpty() || vocabulary.objects().isEmpty()) {
            this.pattern = null;
            return;
        }
        StringBuilder regex = new StringBuilder()
                .append("\\b(").append(alternation(verbs)).append(")\\s+(?:to\\s+)?");
        if (!vocabulary.captureVerbs().isEmpty()) {
            regex.append("(?:(?:").append(alternation(vocabulary.captureVerbs())).append(")\\s+)?");
        }
        if (!vocabulary.qualifiers().isEmpty()) {
            regex.append("(?:(?:").append(alternation(vocabulary.qualifiers()))
                    .append(")(?:['’]s?)?\\s+){0,").append(MAX_QUALIFIERS).append('}');
        }
        regex.append("(").append(alternation(vocabulary.objects())).append(")\\b");
        this.pattern = Pattern.compile(regex.toString());
    }

    @Override
    protected void doTag(String lowerText, Set<String> sink) {
        if (pattern == null) {
            return;
        }
        Matcher m = pattern.matcher(lowerText);
        while (m.find()) {
            String object = m.group(2);
            if (object.length() < MIN_OBJECT_LENGTH) {
                continue;
            }
            String action = vocabulary.normalize(m.group(1).replaceAll("\\s+", " "));
            sink.add(action.replace(' ', '_') + "_" + object);
        }
    }
}
