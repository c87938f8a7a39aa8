package com.surveyaudit.ml;

import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.*;
import com.surveyaudit.nlp.Tokenizer;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 机器人识别特征：文本（熵、重复、字符多样性、键盘连击）、时序（快速作答、节奏规律、相对速度）、
 * 网络（IP 信誉等级、IP 复用）。所有特征归一到 [0,1]，越大越可疑。
 */
public final class BotFeatureExtractor {

    public static final int LOW_ENTROPY = 0;
    public static final int REPETITION = 1;
    public static final int LOW_CHAR_DIVERSITY = 2;
    public static final int KEYBOARD = 3;
    public static final int FAST_GAP_RATIO = 4;
    public static final int TIMING_REGULARITY = 5;
    public static final int SPEED = 6;
    public static final int IP_RISK = 7;
    public static final int IP_REUSE = 8;
    public static final int DIMENSION = 9;

    public static final List<String> FEATURE_NAMES = List.of(
            "lowEntropy", "repetition", "lowCharDiversity", "keyboard",
            "fastGapRatio", "timingRegularity", "speed", "ipRisk", "ipReuse");

    private static final Pattern KEYBOARD_PATTERN = Pattern.compile("qwerty|asdfgh|zxcvbn|asdf|qwer|zxcv|hjkl");
    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    private final List<String> textFields;
    private final String ipField;
    private final double medianCompletion;
    private final Map<String, Integer> ipCounts;
    private final double fastGapSeconds;
    private final int ipReuseSaturation;
    private final List<String> riskyIpPrefixes;

    private BotFeatureExtractor(List<String> textFields, String ipField, double medianCompletion,
                                Map<String, Integer> ipCounts, double fastGapSeconds,
                                int ipReuseSaturation, List<String> riskyIpPrefixes) {
        this.textFields = textFields;
        this.ipField = ipField;
        this.medianCompletion = medianCompletion;
        this.ipCounts = ipCounts;
        this.fastGapSeconds = fastGapSeconds;
        this.ipReuseSaturation = ipReuseSaturation;
        this.riskyIpPrefixes = riskyIpPrefixes;
    }

    /**
     * 基于整个数据集的上下文（完成耗时中位数、IP 出现次数）构建特征提取器
     */
    public static BotFeatureExtractor forDataset(Dataset dataset, CheckParameters params) {
        DatasetSchema schema = dataset.schema();
        List<String> textFields = params.getStringList("textFields");
        if (textFields.isEmpty()) {
            textFields = schema.fieldsOfType(FieldType.TEXT).stream().map(FieldDefinition::getName).toList();
        }
        for (String f : textFields) {
            if (!schema.contains(f)) {
                throw new MisconfiguredCheckException("文本字段不存在: " + f);
            }
        }

        String ipField = params.getString("ipField", null);
        if (ipField == null) {
            ipField = schema.firstWithRole(FieldRole.IP_ADDRESS).map(FieldDefinition::getName).orElse(null);
        } else if (!schema.contains(ipField)) {
            throw new MisconfiguredCheckException("IP 字段不存在: " + ipField);
        }

        DescriptiveStatistics completion = new DescriptiveStatistics();
        Map<String, Integer> ipCounts = new HashMap<>();
        for (SurveyRecord r : dataset.records()) {
            Double secs = r.metadata().completionSeconds();
            if (secs != null) {
                completion.addValue(secs);
            }
            if (ipField != null) {
                String ip = r.text(ipField);
                if (ip != null) {
                    ipCounts.merge(ip, 1, Integer::sum);
                }
            }
        }
        double median = completion.getN() == 0 ? Double.NaN : completion.getPercentile(50);

        return new BotFeatureExtractor(
                List.copyOf(textFields),
                ipField,
                median,
                ipCounts,
                params.getDouble("fastGapSeconds", 1.0),
                Math.max(1, params.getInt("ipReuseSaturation", 4)),
                params.getStringList("riskyIpPrefixes"));
    }

    public double[] features(SurveyRecord record) {
        double[] x = new double[DIMENSION];

        List<String> tokens = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        for (String f : textFields) {
            String text = record.text(f);
            if (text != null) {
                texts.add(text);
                tokens.addAll(Tokenizer.words(text));
            }
        }
        x[LOW_ENTROPY] = lowEntropy(tokens);
        x[REPETITION] = repetition(tokens, texts);
        x[LOW_CHAR_DIVERSITY] = lowCharDiversity(String.join("", texts));
        x[KEYBOARD] = texts.stream().anyMatch(t -> KEYBOARD_PATTERN.matcher(t.toLowerCase(Locale.ROOT)).find()) ? 1.0 : 0.0;

        RecordMetadata meta = record.metadata();
        List<Double> gaps = meta.questionGaps();
        if (!gaps.isEmpty()) {
            x[FAST_GAP_RATIO] = (double) gaps.stream().filter(g -> g < fastGapSeconds).count() / gaps.size();
        }
        x[TIMING_REGULARITY] = timingRegularity(gaps);
        if (meta.completionSeconds() != null && !Double.isNaN(medianCompletion) && medianCompletion > 0) {
            x[SPEED] = Math.max(0.0, 1.0 - meta.completionSeconds() / medianCompletion);
        }

        if (ipField != null) {
            String ip = record.text(ipField);
            x[IP_RISK] = ipRisk(ip, riskyIpPrefixes);
            if (ip != null) {
                x[IP_REUSE] = Math.min(1.0, (ipCounts.getOrDefault(ip, 1) - 1) / (double) ipReuseSaturation);
            }
        }
        return x;
    }

    static double lowEntropy(List<String> tokens) {
        if (tokens.isEmpty()) {
            return 0.0;
        }
        if (tokens.size() == 1) {
            return 0.5;
        }
        Map<String, Integer> counts = new HashMap<>();
        tokens.forEach(t -> counts.merge(t, 1, Integer::sum));
        double entropy = 0.0;
        for (int c : counts.values()) {
            double p = (double) c / tokens.size();
            entropy -= p * Math.log(p);
        }
        return Math.max(0.0, 1.0 - entropy / Math.log(tokens.size()));
    }

    static double repetition(List<String> tokens, List<String> texts) {
        double tokenRepetition = tokens.size() < 2 ? 0.0
                : 1.0 - (double) new HashSet<>(tokens).size() / tokens.size();
        double duplicateFields = 0.0;
        if (texts.size() >= 2) {
            Map<String, Integer> counts = new HashMap<>();
            texts.forEach(t -> counts.merge(t.toLowerCase(Locale.ROOT), 1, Integer::sum));
            long repeated = counts.values().stream().filter(c -> c > 1).mapToLong(Integer::longValue).sum();
            duplicateFields = (double) repeated / texts.size();
        }
        return Math.max(tokenRepetition, duplicateFields);
    }

    static double lowCharDiversity(String joined) {
        String compact = joined.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        if (compact.length() < 5) {
            return 0.0;
        }
        long distinct = compact.chars().distinct().count();
        if (distinct <= 3) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - (double) distinct / Math.min(compact.length(), 20));
    }

    static double timingRegularity(List<Double> gaps) {
        if (gaps.size() < 3) {
            return 0.0;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        gaps.forEach(stats::addValue);
        double std = Math.sqrt(stats.getPopulationVariance());
        if (std < 1.0) {
            return 1.0;
        }
        double mean = stats.getMean();
        return mean <= 0 ? 1.0 : Math.max(0.0, 1.0 - std / mean);
    }

    /**
     * IP 信誉等级：命中风险前缀、回环/保留地址为 1.0，格式错误 0.8，内网/运营商 NAT 0.6，公网 0
     */
    static double ipRisk(String ip, List<String> riskyPrefixes) {
        if (ip == null) {
            return 0.0;
        }
        for (String prefix : riskyPrefixes) {
            if (ip.startsWith(prefix)) {
                return 1.0;
            }
        }
        if (ip.contains(":")) {
            String lower = ip.toLowerCase(Locale.ROOT);
            if (lower.equals("::1")) {
                return 1.0;
            }
            return lower.startsWith("fc") || lower.startsWith("fd") ? 0.6 : 0.0;
        }
        Matcher m = IPV4.matcher(ip);
        if (!m.matches()) {
            return 0.8;
        }
        int[] o = new int[4];
        for (int i = 0; i < 4; i++) {
            o[i] = Integer.parseInt(m.group(i + 1));
            if (o[i] > 255) {
                return 0.8;
            }
        }
        if (o[0] == 127 || o[0] == 0 || o[0] >= 224 || (o[0] == 169 && o[1] == 254)) {
            return 1.0;
        }
        if (o[0] == 10 || (o[0] == 192 && o[1] == 168) || (o[0] == 172 && o[1] >= 16 && o[1] <= 31)
                || (o[0] == 100 && o[1] >= 64 && o[1] <= 127)) {
            return 0.6;
        }
        return 0.0;
    }
}
