package com.geoengine.runtime;

import com.geoengine.plugin.DependencyException;
import com.geoengine.plugin.Plugin;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyResolverTest {

    private final List<String> journal = TestPlugin.newJournal();

    private static Map<String, Plugin> byId(Plugin... plugins) {
        Map<String, Plugin> map = new LinkedHashMap<>();
        for (Plugin p : plugins) {
            map.put(p.getId(), p);
        }
        return map;
    }

    @Test
    void resolve_ordersDependenciesBeforeDependents() {
        DependencyResolution r = DependencyResolver.resolve(byId(
                TestPlugin.of("ui", journal, "analysis", "data"),
                TestPlugin.of("analysis", journal, "data"),
                TestPlugin.of("data", journal)));

        assertEquals(List.of("data", "analysis", "ui"), r.getOrder());
        assertTrue(r.getFailures().isEmpty());
    }

    @Test
    void resolve_keepsRegistrationOrderForIndependentPlugins() {
        DependencyResolution r = DependencyResolver.resolve(byId(
                TestPlugin.of("z", journal),
                TestPlugin.of("a", journal),
                TestPlugin.of("m", journal)));

        assertEquals(List.of("z", "a", "m"), r.getOrder());
    }

    @Test
    void resolve_cycleNamesThePath() {
        DependencyResolution r = DependencyResolver.resolve(byId(
                TestPlugin.of("A", journal, "B"),
                TestPlugin.of("B", journal, "C"),
                TestPlugin.of("C", journal, "A"),
                TestPlugin.of("D", journal)));

        assertEquals(List.of("D"), r.getOrder());
        DependencyException a = r.getFailures().get("A");
        assertEquals("Dependency cycle detected: A -> B -> C -> A", a.getMessage());
        assertEquals(List.of("A", "B", "C", "A"), a.getPath());
        assertTrue(r.getFailures().containsKey("B"));
        assertTrue(r.getFailures().containsKey("C"));
    }

    @Test
    void resolve_missingDependencyFailsDependentChain() {
        DependencyResolution r = DependencyResolver.resolve(byId(
                TestPlugin.of("top", journal, "mid"),
                TestPlugin.of("mid", journal, "ghost"),
                TestPlugin.of("free", journal)));

        assertEquals(List.of("free"), r.getOrder());
        assertTrue(r.getFailures().get("mid").getMessage().contains("missing plugin ghost"));
        assertTrue(r.getFailures().get("top").getMessage().contains("mid"));
        assertFalse(r.isResolved("top"));
    }

    @Test
    void resolve_disabledDependencyFailsDependentAndIsSkipped() {
        TestPlugin off = TestPlugin.of("off", journal);
        off.disable();

        DependencyResolution r = DependencyResolver.resolve(byId(off, TestPlugin.of("user", journal, "off")));

        assertTrue(r.getOrder().isEmpty());
        assertFalse(r.getFailures().containsKey("off"));
        assertTrue(r.getFailures().get("user").getMessage().contains("DISABLED"));
    }

    @Test
    void resolve_diamondListsSharedDependencyOnce() {
        DependencyResolution r = DependencyResolver.resolve(byId(
                TestPlugin.of("top", journal, "left", "right"),
                TestPlugin.of("left", journal, "base"),
                TestPlugin.of("right", journal, "base"),
                TestPlugin.of("base", journal)));

        assertEquals(List.of("base", "left", "right", "top"), r.getOrder());
    }
}
