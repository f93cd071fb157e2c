package com.example.reportcard.util.pattern;

import com.example.reportcard.util.behaviour.dto.Rating;
import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.record.dto.ReportSection;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 成绩单抽取词表与预编译正则
 *
 * 功能：
 * - 已知科目、元数据关键词、课外活动关键词、常见英文词（停用词来源）
 * - 分区标题别名（容忍 OCR 空格/连字符变体）
 * - 行为评级词表及 OCR 变体
 *
 * 所有集合在类加载时构建且不可变，可被并发调用共享。
 * 词表统一以小写存储，比较时先做小写归一化。
 */
public final class PatternLibrary {

    private PatternLibrary() {
    }

    // ==================== 词表 ====================

    /**
     * 常见英文词（姓名抽取的停用词来源之一）
     */
    public static final Set<String> ENGLISH_COMMON_WORDS = immutableSet(
        "name", "student", "school", "state", "gender", "male", "female",
        "form", "level", "nationality", "secondary", "primary", "class",
        "grade", "section", "age", "year", "date", "address", "phone",
        "email", "father", "mother", "guardian", "contact", "code"
    );

    /**
     * 元数据关键词
     */
    public static final Set<String> METADATA_KEYWORDS = immutableSet(
        "name", "student", "school", "state", "gender", "male", "female",
        "form", "level", "nationality", "class", "grade", "section", "age",
        "year", "date", "address", "phone", "email", "behaviour", "behavior",
        "attentiveness", "participation", "attendance", "punctuality",
        "discipline", "ratings", "father", "mother", "guardian", "parent",
        "contact", "code", "id", "number", "admission", "roll"
    );

    /**
     * 课外活动关键词
     */
    public static final Set<String> CO_CURRICULAR_KEYWORDS = immutableSet(
        "member", "club", "society", "team", "day", "competition",
        "event", "activity", "activities", "award", "prize",
        "position", "role", "committee", "group", "association", "winner"
    );

    /**
     * 已知科目：小写 -> 展示名
     *
     * 迭代顺序即子串扫描顺序，多词短语排在其包含的单词之前
     * （"additional mathematics" 先于 "mathematics"）。
     */
    public static final Map<String, String> KNOWN_SUBJECTS;

    static {
        Map<String, String> subjects = new LinkedHashMap<>();
        subjects.put("additional mathematics", "Additional Mathematics");
        subjects.put("physical education", "Physical Education");
        subjects.put("add math", "Add Math");
        subjects.put("mathematics", "Mathematics");
        subjects.put("matematik", "Matematik");
        subjects.put("maths", "Maths");
        subjects.put("math", "Math");
        subjects.put("science", "Science");
        subjects.put("sains", "Sains");
        subjects.put("physics", "Physics");
        subjects.put("chemistry", "Chemistry");
        subjects.put("biology", "Biology");
        subjects.put("history", "History");
        subjects.put("sejarah", "Sejarah");
        subjects.put("geography", "Geography");
        subjects.put("english", "English");
        subjects.put("languages", "Languages");
        subjects.put("language", "Language");
        subjects.put("malay", "Malay");
        subjects.put("bahasa", "Bahasa");
        subjects.put("chinese", "Chinese");
        subjects.put("mandarin", "Mandarin");
        subjects.put("tamil", "Tamil");
        subjects.put("arabic", "Arabic");
        subjects.put("literature", "Literature");
        subjects.put("economics", "Economics");
        subjects.put("accounting", "Accounting");
        subjects.put("business", "Business");
        subjects.put("computer", "Computer");
        subjects.put("ict", "ICT");
        subjects.put("moral", "Moral");
        subjects.put("pendidikan", "Pendidikan");
        subjects.put("music", "Music");
        subjects.put("art", "Art");
        subjects.put("pe", "PE");
        KNOWN_SUBJECTS = Collections.unmodifiableMap(subjects);
    }

    private static final Map<String, Pattern> SUBJECT_PATTERNS;

    static {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String subject : KNOWN_SUBJECTS.keySet()) {
            patterns.put(subject, wordPattern(subject));
        }
        SUBJECT_PATTERNS = Collections.unmodifiableMap(patterns);
    }

    /**
     * 排名展示用的双词科目短语（按顺序匹配，先命中先用）
     */
    public static final List<String> TWO_WORD_SUBJECTS = Collections.unmodifiableList(Arrays.asList(
        "bahasa malaysia",
        "physical education",
        "social science",
        "computer science",
        "moral education",
        "additional mathematics",
        "general science",
        "environmental science",
        "information technology",
        "class participation",
        "community service",
        "chess club",
        "football",
        "club",
        "sejarah (history)"
    ));

    /**
     * 排名标签简化时跳过的虚词
     */
    public static final Set<String> RANKING_SKIP_WORDS = immutableSet(
        "and", "the", "for", "with", "in", "on", "at", "to", "of"
    );

    /**
     * 马来西亚州属（多词州名在前，保证先匹配完整名称）
     */
    public static final List<String> MALAYSIAN_STATES = Collections.unmodifiableList(Arrays.asList(
        "Negeri Sembilan", "Kuala Lumpur",
        "Selangor", "Johor", "Penang", "Perak", "Kedah",
        "Kelantan", "Terengganu", "Pahang", "Melaka",
        "Sabah", "Sarawak", "Perlis", "Putrajaya", "Labuan"
    ));

    /**
     * 元数据行的前缀键（分类器用）
     */
    public static final List<String> METADATA_LINE_KEYS = Collections.unmodifiableList(Arrays.asList(
        "student name", "school level", "name", "gender", "state", "school",
        "form", "attendance", "nationality"
    ));

    /**
     * 表头常见词（列名取姓名时排除，如 "Subject Score"）
     */
    public static final Set<String> TABLE_HEADER_WORDS = immutableSet(
        "label", "score", "scores", "maximum", "max", "value", "notes", "subject",
        "subjects", "mark", "marks", "total", "percentage", "result", "results",
        "remarks", "rating", "column", "unnamed", "details", "information", "info"
    );

    /**
     * 停用词全集 = 元数据关键词 ∪ 已知科目（拆成单词） ∪ 常见英文词 ∪ 课外活动关键词
     */
    public static final Set<String> STOP_WORDS;

    static {
        Set<String> stop = new HashSet<>();
        stop.addAll(METADATA_KEYWORDS);
        stop.addAll(ENGLISH_COMMON_WORDS);
        stop.addAll(CO_CURRICULAR_KEYWORDS);
        for (String subject : KNOWN_SUBJECTS.keySet()) {
            stop.addAll(Arrays.asList(subject.split(" ")));
        }
        STOP_WORDS = Collections.unmodifiableSet(stop);
    }

    // ==================== 分区标题 ====================

    /**
     * 分区标题别名（紧凑形式：小写、去空白、去连字符）
     *
     * 同一分区的别名是无序集合，重复项没有意义。
     */
    private static final Map<ReportSection, Set<String>> SECTION_ALIASES;

    static {
        Map<ReportSection, Set<String>> aliases = new LinkedHashMap<>();
        aliases.put(ReportSection.STUDENT_DETAILS, immutableSet(
            "studentdetails", "studentbetalls", "studentinformation", "studentinfo", "details"));
        aliases.put(ReportSection.SUBJECTS, immutableSet(
            "subjects", "subjectscores", "subjectscore", "subject", "academicresults"));
        aliases.put(ReportSection.BEHAVIOUR, immutableSet(
            "behaviour", "behavior", "behaviourratings", "behaviorratings", "ratings", "conduct"));
        aliases.put(ReportSection.CO_CURRICULAR, immutableSet(
            "cocurricular", "cocurricularactivities", "extracurricular", "achievements", "achievement"));
        SECTION_ALIASES = Collections.unmodifiableMap(aliases);
    }

    /**
     * 标题行最多单词数
     */
    private static final int MAX_HEADER_WORDS = 4;

    // ==================== 评级 ====================

    /**
     * 评级 OCR 变体与同义词（小写键）
     */
    public static final Map<String, Rating> RATING_VARIANTS;

    static {
        Map<String, Rating> variants = new LinkedHashMap<>();
        variants.put("g00d", Rating.GOOD);
        variants.put("g0od", Rating.GOOD);
        variants.put("go0d", Rating.GOOD);
        variants.put("0k", Rating.FAIR);
        variants.put("very good", Rating.VERY_GOOD);
        variants.put("verygood", Rating.VERY_GOOD);
        variants.put("excellent", Rating.EXCELLENT);
        variants.put("good", Rating.GOOD);
        variants.put("fair", Rating.FAIR);
        variants.put("average", Rating.FAIR);
        variants.put("avg", Rating.FAIR);
        variants.put("ok", Rating.FAIR);
        variants.put("okay", Rating.FAIR);
        variants.put("poor", Rating.POOR);
        variants.put("p00r", Rating.POOR);
        variants.put("bad", Rating.BAD);
        variants.put("b4d", Rating.BAD);
        variants.put("b@d", Rating.BAD);
        variants.put("satisfactory", Rating.GOOD);
        variants.put("unsatisfactory", Rating.POOR);
        RATING_VARIANTS = Collections.unmodifiableMap(variants);
    }

    /**
     * OCR 字符混淆修复表
     */
    public static final Map<Character, Character> OCR_SUBSTITUTIONS;

    static {
        Map<Character, Character> subs = new LinkedHashMap<>();
        subs.put('0', 'o');
        subs.put('1', 'l');
        subs.put('5', 's');
        subs.put('@', 'a');
        subs.put('4', 'a');
        subs.put('$', 's');
        OCR_SUBSTITUTIONS = Collections.unmodifiableMap(subs);
    }

    /**
     * 评级词正则交替式（按长度降序，多词评级内部允许任意空格）
     */
    public static final String RATING_ALTERNATION;

    static {
        Set<String> tokens = new TreeSet<>(new Comparator<String>() {
            @Override
            public int compare(String a, String b) {
                int byLength = Integer.compare(b.length(), a.length());
                return byLength != 0 ? byLength : a.compareTo(b);
            }
        });
        tokens.addAll(RATING_VARIANTS.keySet());
        for (Rating rating : Rating.values()) {
            tokens.add(rating.getLabel().toLowerCase(Locale.ROOT));
        }

        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            String[] parts = token.split(" ");
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    sb.append("[ \\t]+");
                }
                sb.append(Pattern.quote(parts[i]));
            }
        }
        RATING_ALTERNATION = sb.toString();
    }

    // ==================== 公共方法 ====================

    /**
     * 判断单词是否为停用词（忽略大小写）
     */
    public static boolean isStopWord(String token) {
        return token != null && STOP_WORDS.contains(token.toLowerCase(Locale.ROOT));
    }

    /**
     * 判断单词/短语是否为已知科目，是则返回展示名
     *
     * @param token 单词或短语
     * @return 科目展示名；不是已知科目返回 null
     */
    public static String knownSubject(String token) {
        if (token == null) {
            return null;
        }
        return KNOWN_SUBJECTS.get(token.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 在文本中按词表顺序查找第一个出现的已知科目短语（整词匹配，忽略大小写）
     *
     * @param text 标签文本
     * @return 命中的科目展示名，未命中返回 null
     */
    public static String findSubjectPhrase(String text) {
        int[] span = findSubjectSpan(text);
        if (span == null) {
            return null;
        }
        return KNOWN_SUBJECTS.get(text.substring(span[0], span[1]).toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " "));
    }

    /**
     * 查找第一个（按词表顺序）已知科目短语在文本中的位置
     *
     * @param text 标签文本
     * @return [start, end)，未命中返回 null
     */
    public static int[] findSubjectSpan(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        for (Pattern pattern : SUBJECT_PATTERNS.values()) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return new int[]{m.start(), m.end()};
            }
        }
        return null;
    }

    /**
     * 是否包含元数据关键词（整词，忽略大小写）
     */
    public static boolean containsMetadataKeyword(String text) {
        return containsAnyWord(text, METADATA_KEYWORDS);
    }

    /**
     * 是否包含课外活动关键词（整词，忽略大小写）
     */
    public static boolean containsCoCurricularKeyword(String text) {
        return containsAnyWord(text, CO_CURRICULAR_KEYWORDS);
    }

    /**
     * 检测分区标题
     *
     * 规则：
     * 1. 含数字的行不是标题
     * 2. 单词数不超过 4
     * 3. 紧凑形式（小写、去空白/连字符/冒号）以某个别名开头
     *
     * @param line 原始行
     * @return 命中的分区，非标题返回 null
     */
    public static ReportSection matchSectionHeader(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty() || TextUtils.containsDigit(trimmed)) {
            return null;
        }
        if (trimmed.split("\\s+").length > MAX_HEADER_WORDS) {
            return null;
        }

        String compact = compactForm(trimmed);
        for (Map.Entry<ReportSection, Set<String>> entry : SECTION_ALIASES.entrySet()) {
            for (String alias : entry.getValue()) {
                if (compact.startsWith(alias)) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    /**
     * 检测元数据行（以元数据键开头，或以整词形式包含元数据键且不止一个单词）
     *
     * @param line 原始行
     * @return 命中的元数据键，未命中返回 null
     */
    public static String matchMetadataKey(String line) {
        if (line == null) {
            return null;
        }
        String low = line.trim().toLowerCase(Locale.ROOT);
        if (low.isEmpty()) {
            return null;
        }
        for (String key : METADATA_LINE_KEYS) {
            if (low.startsWith(key) && (low.length() == key.length()
                    || !Character.isLetter(low.charAt(key.length())))) {
                return key;
            }
        }
        if (low.split("\\s+").length > 1) {
            for (String key : METADATA_LINE_KEYS) {
                if (wordPattern(key).matcher(low).find()) {
                    return key;
                }
            }
        }
        return null;
    }

    /**
     * 构造忽略大小写的整词匹配正则（短语内部允许任意空白）
     */
    public static Pattern wordPattern(String phrase) {
        String[] parts = phrase.trim().split("\\s+");
        StringBuilder sb = new StringBuilder("(?<![A-Za-z])");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append("\\s+");
            }
            sb.append(Pattern.quote(parts[i]));
        }
        sb.append("(?![A-Za-z])");
        return Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE);
    }

    // ==================== 私有方法 ====================

    private static boolean containsAnyWord(String text, Set<String> words) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String token : text.split("[^A-Za-z]+")) {
            if (!token.isEmpty() && words.contains(token.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static String compactForm(String text) {
        return text.toLowerCase(Locale.ROOT).replaceAll("[\\s\\-_:.]+", "");
    }

    private static Set<String> immutableSet(String... values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(values)));
    }
}
