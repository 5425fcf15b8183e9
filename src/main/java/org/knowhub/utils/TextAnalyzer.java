package org.knowhub.utils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 轻量分词：小写化、按非字母数字切分、去停用词。
 * 关键词检索（内存后端）和追问改写共用这一套规则。
 */
public final class TextAnalyzer {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    public static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "if", "then", "so",
            "is", "are", "was", "were", "be", "been", "being", "am",
            "do", "does", "did", "done", "have", "has", "had",
            "i", "me", "my", "we", "our", "you", "your", "he", "she", "they", "them", "their",
            "it", "its", "this", "that", "these", "those", "there", "here",
            "what", "which", "who", "whom", "whose", "when", "where", "why", "how",
            "of", "to", "in", "on", "at", "by", "for", "from", "with", "about", "into", "as",
            "can", "could", "should", "would", "will", "shall", "may", "might", "must",
            "please", "tell", "explain", "know", "any", "some", "also", "else", "more",
            "not", "no", "yes", "just", "than", "too", "very");

    private TextAnalyzer() {
    }

    /**
     * 全部词项（小写），保留顺序与重复
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * 去掉停用词后的词项，保留顺序与重复
     */
    public static List<String> contentTerms(String text) {
        List<String> terms = new ArrayList<>();
        for (String token : tokenize(text)) {
            if (!STOPWORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    /**
     * 去重后的内容词，保留首次出现顺序
     */
    public static List<String> distinctContentTerms(String text) {
        return new ArrayList<>(new LinkedHashSet<>(contentTerms(text)));
    }
}
