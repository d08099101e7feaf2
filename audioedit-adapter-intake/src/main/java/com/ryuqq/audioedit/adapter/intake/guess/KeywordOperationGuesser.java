package com.ryuqq.audioedit.adapter.intake.guess;

import com.ryuqq.audioedit.application.interpreter.OperationGuesser;
import com.ryuqq.audioedit.application.interpreter.RawOperation;
import com.ryuqq.audioedit.core.model.OperationKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based {@link OperationGuesser} for short English instructions.
 *
 * <p>Each operation kind has a set of aliases matched on word boundaries. Matches are
 * returned in the order they appear in the text, at most once per kind. The text between
 * one match and the next is that operation's clause; parameters are extracted from the
 * clause only, while direction words ("slow", "lower", "cut") may also precede the keyword, so in "trim from 5s to 10s then fade out over 2s" the trim gets 5000..10000
 * and the fade gets 2000.</p>
 *
 * <p><strong>Extraction rules:</strong></p>
 * <ul>
 *   <li>Times: {@code 250ms}, {@code 1.5 s}, {@code 2 min}, {@code 1:30}</li>
 *   <li>Levels: {@code -3 dB}</li>
 *   <li>Speed: {@code 1.5x}; "slow" inverts a factor above 1</li>
 *   <li>Pitch: {@code 3 semitones}; "down" or "lower" makes it negative</li>
 *   <li>Format: wav, mp3, flac, aac, ogg, m4a, plus {@code 320k} and {@code 48 kHz}</li>
 *   <li>Strength: {@code 60%}</li>
 *   <li>Compression ratio: {@code 4:1}</li>
 *   <li>EQ: "bass" (100 Hz) and "treble" (8 kHz), boosted unless "cut" or "reduce" is present</li>
 * </ul>
 *
 * <p>Output is untrusted. The interpreter validates it exactly like structured input, so
 * a missing or out-of-range value surfaces as a validation error rather than being clamped
 * here. Merge is never guessed because its sources cannot be inferred from text.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class KeywordOperationGuesser implements OperationGuesser {

    private static final Map<OperationKind, Pattern> ALIASES = new EnumMap<>(OperationKind.class);

    static {
        ALIASES.put(OperationKind.TRIM, word("trim|crop|clip|cut out|cut the first|cut from|keep only"));
        ALIASES.put(OperationKind.NORMALIZE, word("normali[sz]e|normali[sz]ation|loudness|louder"));
        ALIASES.put(OperationKind.FADE_IN, word("fade[ -]?in"));
        ALIASES.put(OperationKind.FADE_OUT, word("fade[ -]?out"));
        ALIASES.put(OperationKind.SPEED_CHANGE, word("speed up|slow down|speed|tempo|faster|slower"));
        ALIASES.put(OperationKind.PITCH_CHANGE, word("pitch|transpose|semitones?"));
        ALIASES.put(OperationKind.REVERB, word("reverb|echo|room sound"));
        ALIASES.put(OperationKind.NOISE_REDUCTION, word("denoise|noise reduction|(?:remove|reduce) (?:the )?(?:background )?noise|hiss"));
        ALIASES.put(OperationKind.EQUALIZE, word("equali[sz]e|eq|bass|treble"));
        ALIASES.put(OperationKind.COMPRESS, word("compress|compressor|compression"));
        ALIASES.put(OperationKind.CONVERT_FORMAT, word("convert|export|transcode|save as"));
        ALIASES.put(OperationKind.SPLIT, word("split|chunks?|segments?"));
    }

    private static final Pattern TIME = Pattern.compile(
        "(\\d+(?:\\.\\d+)?)\\s*(ms|msec|milliseconds?|s|secs?|seconds?|m|mins?|minutes?)\\b");
    private static final Pattern CLOCK = Pattern.compile("\\b(\\d{1,3}):(\\d{2})\\b");
    private static final Pattern DECIBELS = Pattern.compile("([+-]?\\d+(?:\\.\\d+)?)\\s*db\\b");
    private static final Pattern FACTOR = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*x\\b");
    private static final Pattern SEMITONES = Pattern.compile("([+-]?\\d+(?:\\.\\d+)?)\\s*semitones?\\b");
    private static final Pattern PERCENT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*%");
    private static final Pattern RATIO = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*:\\s*1\\b");
    private static final Pattern FORMAT = Pattern.compile("\\b(wav|mp3|flac|aac|ogg|m4a)\\b");
    private static final Pattern BITRATE = Pattern.compile("\\b(\\d{2,3})\\s*k(?:bps)?\\b");
    private static final Pattern SAMPLE_RATE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*khz\\b");

    private static final double DEFAULT_EQ_GAIN_DB = 3.0;

    @Override
    public List<RawOperation> guess(String instruction) {
        if (instruction == null || instruction.isBlank()) {
            return List.of();
        }
        String text = instruction.toLowerCase(Locale.ROOT);

        List<Hit> hits = new ArrayList<>();
        for (Map.Entry<OperationKind, Pattern> alias : ALIASES.entrySet()) {
            Matcher matcher = alias.getValue().matcher(text);
            if (matcher.find()) {
                hits.add(new Hit(alias.getKey(), matcher.start(), matcher.end()));
            }
        }
        hits.sort(Comparator.comparingInt(Hit::start));

        List<RawOperation> guessed = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            Hit hit = hits.get(i);
            int clauseEnd = i + 1 < hits.size() ? hits.get(i + 1).start() : text.length();
            int contextStart = i > 0 ? Math.min(hits.get(i - 1).end(), hit.start()) : 0;
            String clause = text.substring(hit.start(), Math.max(hit.end(), clauseEnd));
            String context = text.substring(contextStart, Math.max(hit.end(), clauseEnd));
            guessed.add(RawOperation.of(hit.kind().wireName(), parameters(hit.kind(), clause, context)));
        }
        return guessed;
    }

    private static Map<String, Object> parameters(OperationKind kind, String clause, String context) {
        Map<String, Object> params = new LinkedHashMap<>();
        switch (kind) {
            case TRIM -> trim(clause, params);
            case NORMALIZE -> firstNumber(DECIBELS, clause).ifPresent(db -> params.put("target_db", db));
            case FADE_IN, FADE_OUT -> {
                List<Long> times = times(clause);
                if (!times.isEmpty()) {
                    params.put("duration_ms", times.get(0));
                }
            }
            case SPEED_CHANGE -> params.put("factor", speedFactor(clause, context));
            case PITCH_CHANGE -> params.put("semitones", semitones(clause, context));
            case NOISE_REDUCTION -> firstNumber(PERCENT, clause).ifPresent(p -> params.put("strength", p / 100.0));
            case EQUALIZE -> {
                Map<String, Object> bands = bands(clause, context);
                if (!bands.isEmpty()) {
                    params.put("bands", bands);
                }
            }
            case COMPRESS -> {
                firstNumber(RATIO, clause).ifPresent(r -> params.put("ratio", r));
                firstNumber(DECIBELS, clause).ifPresent(db -> params.put("threshold_db", db));
            }
            case CONVERT_FORMAT -> convert(clause, params);
            case SPLIT -> {
                List<Long> times = times(clause);
                if (!times.isEmpty()) {
                    params.put("segment_ms", times.get(0));
                }
            }
            default -> {
                // reverb and merge take defaults or cannot be inferred
            }
        }
        return params;
    }

    private static void trim(String clause, Map<String, Object> params) {
        List<Long> times = times(clause);
        if (times.size() >= 2) {
            params.put("start_ms", times.get(0));
            params.put("end_ms", times.get(1));
        } else if (times.size() == 1) {
            // "keep the first 30 seconds"
            params.put("start_ms", 0L);
            params.put("end_ms", times.get(0));
        }
    }

    private static double speedFactor(String clause, String context) {
        boolean slower = context.contains("slow");
        double factor = firstNumber(FACTOR, clause).orElse(slower ? 0.75 : 1.5);
        if (slower && factor > 1.0) {
            factor = 1.0 / factor;
        }
        return factor;
    }

    private static double semitones(String clause, String context) {
        double semitones = firstNumber(SEMITONES, clause).orElse(2.0);
        if (context.contains("down") || context.contains("lower")) {
            semitones = -Math.abs(semitones);
        }
        return semitones;
    }

    private static Map<String, Object> bands(String clause, String context) {
        boolean cut = context.contains("cut") || context.contains("reduce") || context.contains("less");
        double gain = Math.abs(firstNumber(DECIBELS, clause).orElse(DEFAULT_EQ_GAIN_DB));
        double signed = cut ? -gain : gain;
        Map<String, Object> bands = new LinkedHashMap<>();
        if (clause.contains("bass")) {
            bands.put("100", signed);
        }
        if (clause.contains("treble")) {
            bands.put("8000", signed);
        }
        return bands;
    }

    private static void convert(String clause, Map<String, Object> params) {
        Matcher format = FORMAT.matcher(clause);
        if (format.find()) {
            params.put("target_format", format.group(1));
        }
        Matcher bitrate = BITRATE.matcher(clause);
        if (bitrate.find()) {
            params.put("bitrate", bitrate.group(1) + "k");
        }
        firstNumber(SAMPLE_RATE, clause).ifPresent(khz -> params.put("sample_rate", Math.round(khz * 1000)));
        if (clause.contains("mono")) {
            params.put("channels", 1);
        } else if (clause.contains("stereo")) {
            params.put("channels", 2);
        }
    }

    /**
     * All time values in the clause, in milliseconds, in text order.
     */
    static List<Long> times(String clause) {
        List<TimedValue> found = new ArrayList<>();
        Matcher clock = CLOCK.matcher(clause);
        while (clock.find()) {
            long ms = (Long.parseLong(clock.group(1)) * 60 + Long.parseLong(clock.group(2))) * 1000;
            found.add(new TimedValue(clock.start(), ms));
        }
        Matcher time = TIME.matcher(clause);
        while (time.find()) {
            double value = Double.parseDouble(time.group(1));
            found.add(new TimedValue(time.start(), Math.round(value * unitMillis(time.group(2)))));
        }
        found.sort(Comparator.comparingInt(TimedValue::position));
        List<Long> values = new ArrayList<>(found.size());
        for (TimedValue value : found) {
            values.add(value.millis());
        }
        return values;
    }

    private static long unitMillis(String unit) {
        if (unit.startsWith("ms") || unit.startsWith("milli")) {
            return 1L;
        }
        if (unit.startsWith("m")) {
            return 60_000L;
        }
        return 1_000L;
    }

    private static Optional<Double> firstNumber(Pattern pattern, String clause) {
        Matcher matcher = pattern.matcher(clause);
        return matcher.find()
            ? Optional.of(Double.parseDouble(matcher.group(1)))
            : Optional.empty();
    }

    private static Pattern word(String alternatives) {
        return Pattern.compile("\\b(?:" + alternatives + ")\\b");
    }

    private record Hit(OperationKind kind, int start, int end) {
    }

    private record TimedValue(int position, long millis) {
    }
}
