package info.isaksson.erland.reacttoangular.rules;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NameUtilTest {

    @Test
    void kebabCasesComponentNames() {
        assertEquals("todo-box", NameUtil.kebab("TodoBox"));
        assertEquals("html-view", NameUtil.kebab("HTMLView"));
        assertEquals("nav-item", NameUtil.kebab("Nav.Item"));
        assertEquals("timer", NameUtil.kebab("Timer"));
        assertEquals("app-todo-box", NameUtil.selector("TodoBox"));
    }

    @Test
    void pascalCasesTagsAndFileNames() {
        assertEquals("TodoBox", NameUtil.pascal("todo-box"));
        assertEquals("Input", NameUtil.pascal("input"));
        assertEquals("NavItem", NameUtil.pascal("Nav.Item"));
    }

    @Test
    void uniqueNumbersFromTwo() {
        assertEquals("onClick", NameUtil.unique("onClick", Set.of()));
        assertEquals("onClick2", NameUtil.unique("onClick", Set.of("onClick")));
        assertEquals("onClick3", NameUtil.unique("onClick", Set.of("onClick", "onClick2")));
    }
}
