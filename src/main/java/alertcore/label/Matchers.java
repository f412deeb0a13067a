package alertcore.label;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public final class Matchers {

    private Matchers() {
    }

    /**
     * 所有匹配器都满足时返回true，空集合视为匹配
     */
    public static boolean matchesAll(LabelSet labels, Collection<Matcher> matchers) {
        if (matchers == null) {
            return true;
        }
        for (Matcher matcher : matchers) {
            if (!matcher.matches(labels)) {
                return false;
            }
        }
        return true;
    }

    public static List<Matcher> parseAll(Collection<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return Collections.emptyList();
        }
        List<Matcher> result = new ArrayList<>(texts.size());
        for (String text : texts) {
            result.add(Matcher.parse(text));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 判断一组匹配器是否自相矛盾，例如同一标签上两个不同的等值匹配
     */
    public static boolean isContradictory(Collection<Matcher> matchers) {
        if (matchers == null) {
            return false;
        }
        for (Matcher a : matchers) {
            for (Matcher b : matchers) {
                if (a == b || !a.getName().equals(b.getName())) {
                    continue;
                }
                if (a.getType() == Matcher.MatchType.EQUAL && b.getType() == Matcher.MatchType.EQUAL
                        && !a.getValue().equals(b.getValue())) {
                    return true;
                }
                if (a.getType() == Matcher.MatchType.EQUAL && b.getType() == Matcher.MatchType.NOT_EQUAL
                        && a.getValue().equals(b.getValue())) {
                    return true;
                }
            }
        }
        return false;
    }
}
