package com.phillippitts.holderbot.service.aggregation;

import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw oracle reply into a {@link RegionVerdict}.
 *
 * <p>Two shapes are accepted: a JSON object with {@code material}, {@code type},
 * {@code confidence} and optional {@code rationale} (or {@code reasoning}), possibly wrapped in a
 * markdown code fence; or the four-line format requested by {@link AnalysisRegion#instruction}.
 * A confidence written as a percentage ({@code 85%} or {@code 85}) is scaled to [0, 1].
 * Anything else, including a confidence outside [0, 1] after scaling, is a parse failure.
 */
@Component
public class OracleReplyParser {

    private static final Pattern MATERIAL = line("material");
    private static final Pattern TYPE = line("type");
    private static final Pattern CONFIDENCE = line("confidence");
    private static final Pattern REASONING = line("(?:reasoning|rationale)");
    private static final Pattern NUMBER = Pattern.compile("(-?\\d+(?:[.,]\\d+)?)\\s*(%)?");

    public Optional<RegionVerdict> parse(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        String text = stripFence(reply.trim());
        if (text.startsWith("{")) {
            return parseJson(text);
        }
        return parseLines(text);
    }

    private Optional<RegionVerdict> parseJson(String text) {
        try {
            JSONObject json = new JSONObject(text);
            String material = json.optString("material", "").trim();
            String type = json.optString("type", "").trim();
            Object rawConfidence = json.opt("confidence");
            String rationale = json.optString("rationale", json.optString("reasoning", ""));
            if (rawConfidence == null) {
                return Optional.empty();
            }
            return verdict(material, type, String.valueOf(rawConfidence), rationale);
        } catch (JSONException e) {
            return Optional.empty();
        }
    }

    private Optional<RegionVerdict> parseLines(String text) {
        String material = group(MATERIAL, text);
        String type = group(TYPE, text);
        String confidence = group(CONFIDENCE, text);
        if (material == null || type == null || confidence == null) {
            return Optional.empty();
        }
        String rationale = group(REASONING, text);
        return verdict(material, type, confidence, rationale);
    }

    private static Optional<RegionVerdict> verdict(String material, String type, String confidence,
                                                   String rationale) {
        String m = clean(material);
        String t = clean(type);
        if (m.isEmpty() || t.isEmpty()) {
            return Optional.empty();
        }
        Double c = confidence(confidence);
        if (c == null) {
            return Optional.empty();
        }
        return Optional.of(new RegionVerdict(m, t, c, rationale == null ? "" : rationale.trim()));
    }

    static Double confidence(String raw) {
        Matcher m = NUMBER.matcher(raw.trim());
        if (!m.find()) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(m.group(1).replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
        if (m.group(2) != null || (value > 1.0 && value <= 100.0)) {
            value = value / 100.0;
        }
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            return null;
        }
        return value;
    }

    // "[kov]" or "**kov**" are common decorations
    private static String clean(String value) {
        String v = value.trim();
        return v.replaceAll("^[\\[*\"'`]+|[\\]*\"'`.]+$", "").trim();
    }

    private static String stripFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, lastFence).trim();
    }

    private static String group(Pattern p, String text) {
        Matcher m = p.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    private static Pattern line(String key) {
        return Pattern.compile("^[\\s*\\-]*" + key + "[\\s*]*:\\s*(.+)$",
                Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.UNICODE_CASE);
    }
}
