package info.isaksson.erland.reacttoangular.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the cross-object invariants of a finished {@link IrComponent}.
 *
 * <p>Per-object invariants are enforced by the IR constructors; this validator covers what needs
 * the whole model: unique names across member kinds, unique node ids, an acyclic template tree and
 * event bindings that resolve.</p>
 */
public final class ModelValidator {

    private ModelValidator() {}

    /** Throws {@link ModelValidationError} listing every violated invariant. */
    public static void validate(IrComponent component) {
        List<String> problems = check(component);
        if (!problems.isEmpty()) {
            throw new ModelValidationError(problems);
        }
    }

    public static List<String> check(IrComponent component) {
        if (component == null) return List.of("component is null");
        List<String> problems = new ArrayList<>();

        Set<String> stateNames = new LinkedHashSet<>();
        for (IrStateBinding s : component.states) {
            if (!stateNames.add(s.name)) problems.add("duplicate state '" + s.name + "'");
        }

        // Inputs, states, properties and methods share the class namespace.
        Map<String, String> members = new HashMap<>();
        for (IrProperty p : component.inputs) claim(members, p.name, "input", problems);
        for (String s : stateNames) claim(members, s, "state", problems);
        for (IrProperty p : component.properties) claim(members, p.name, "property", problems);
        for (IrMethod m : component.methods) claim(members, m.name, "method", problems);

        Map<String, IrTemplateNode> nodesById = new HashMap<>();
        if (component.template != null) {
            walk(component.template, nodesById, Collections.newSetFromMap(new IdentityHashMap<>()), problems);
        }

        for (IrEventBinding e : component.events) {
            IrTemplateNode owner = nodesById.get(e.elementId);
            if (owner == null) {
                problems.add("event '" + e.event + "' is bound to unknown element " + e.elementId);
            } else if (owner.kind != IrTemplateNodeKind.ELEMENT) {
                problems.add("event '" + e.event + "' is bound to non-element node " + e.elementId);
            }
            if (e.kind != IrEventKind.INLINE_EXPRESSION || e.targetMethod != null) {
                if (component.method(e.targetMethod) == null) {
                    problems.add("event '" + e.event + "' on " + e.elementId + " calls unknown method '" + e.targetMethod + "'");
                }
            }
        }

        for (IrStateBinding s : component.states) {
            if (s.twoWay && !hasTwoWayNode(component.template, s.name)) {
                problems.add("state '" + s.name + "' is marked two-way but no element binds it");
            }
        }
        checkTwoWayTargets(component.template, stateNames, problems);

        Set<Integer> effectIndexes = new HashSet<>();
        for (IrEffect effect : component.effects) {
            if (!effectIndexes.add(effect.index)) problems.add("duplicate effect index " + effect.index);
            for (String h : effect.hoisted) {
                if (!"property".equals(members.get(h))) {
                    problems.add("effect " + effect.index + " hoists '" + h + "' without a matching property");
                }
            }
        }
        return problems;
    }

    private static void claim(Map<String, String> members, String name, String kind, List<String> problems) {
        String previous = members.putIfAbsent(name, kind);
        if (previous != null) {
            problems.add("member name '" + name + "' is used by both a " + previous + " and a " + kind);
        }
    }

    private static void walk(IrTemplateNode node, Map<String, IrTemplateNode> byId, Set<IrTemplateNode> path,
                             List<String> problems) {
        if (!path.add(node)) {
            problems.add("template tree has a cycle at " + node.id);
            return;
        }
        IrTemplateNode previous = byId.putIfAbsent(node.id, node);
        if (previous != null && previous != node) {
            problems.add("duplicate template node id " + node.id);
        }
        for (IrTemplateNode child : node.children) {
            walk(child, byId, path, problems);
        }
        path.remove(node);
    }

    private static boolean hasTwoWayNode(IrTemplateNode node, String state) {
        if (node == null) return false;
        if (state.equals(node.twoWayProperty)) return true;
        for (IrTemplateNode child : node.children) {
            if (hasTwoWayNode(child, state)) return true;
        }
        return false;
    }

    private static void checkTwoWayTargets(IrTemplateNode node, Set<String> states, List<String> problems) {
        if (node == null) return;
        if (node.twoWayProperty != null && !states.contains(node.twoWayProperty)) {
            problems.add("node " + node.id + " is two-way bound to unknown state '" + node.twoWayProperty + "'");
        }
        for (IrTemplateNode child : node.children) {
            checkTwoWayTargets(child, states, problems);
        }
    }
}
