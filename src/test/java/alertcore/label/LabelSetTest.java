package alertcore.label;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LabelSetTest {

    @Test
    void equalityIgnoresInsertionOrder() {
        Map<String, String> first = new HashMap<>();
        first.put("b", "2");
        first.put("a", "1");
        LabelSet a = LabelSet.of(first);
        LabelSet b = LabelSet.of("a", "1", "b", "2");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a.fingerprint(), b.fingerprint());
        assertEquals("{a=\"1\", b=\"2\"}", a.toString());
    }

    @Test
    void absentLabelIsEmpty() {
        LabelSet labels = LabelSet.of("a", "1");
        assertEquals("", labels.get("missing"));
        assertFalse(labels.contains("missing"));
    }

    @Test
    void mergeLetsOtherWin() {
        LabelSet result = LabelSet.of("a", "1", "b", "2").merge(LabelSet.of("b", "3", "c", "4"));
        assertEquals(LabelSet.of("a", "1", "b", "3", "c", "4"), result);
    }

    @Test
    void projectKeepsOnlyNamedLabels() {
        LabelSet labels = LabelSet.of("alertname", "HighCpu", "instance", "db-1", "team", "infra");
        assertEquals(LabelSet.of("alertname", "HighCpu"), labels.project(Arrays.asList("alertname", "cluster")));
        assertTrue(labels.project(Arrays.asList("cluster")).isEmpty());
    }

    @Test
    void withDoesNotMutateOriginal() {
        LabelSet labels = LabelSet.of("a", "1");
        LabelSet changed = labels.with("a", "2");
        assertEquals("1", labels.get("a"));
        assertEquals("2", changed.get("a"));
        assertNotEquals(labels.fingerprint(), changed.fingerprint());
    }

    @Test
    void quotesInValuesDoNotCollide() {
        LabelSet packed = LabelSet.of("a", "x\", b=\"y");
        LabelSet split = LabelSet.of("a", "x", "b", "y");

        assertEquals("{a=\"x\\\", b=\\\"y\"}", packed.toString());
        assertNotEquals(split.toString(), packed.toString());
        assertNotEquals(split.fingerprint(), packed.fingerprint());
    }

    @Test
    void backslashesAreEscapedBeforeQuotes() {
        LabelSet trailing = LabelSet.of("a", "x\\", "b", "y");
        LabelSet plain = LabelSet.of("a", "x", "b", "y");

        assertEquals("{a=\"x\\\\\", b=\"y\"}", trailing.toString());
        assertNotEquals(plain.fingerprint(), trailing.fingerprint());
    }
}
