package info.isaksson.erland.reacttoangular.emitter;

/** File and class names derived from a component name. */
public final class ComponentNames {

    private ComponentNames() {}

    /** {@code todo-box -> TodoBox}; an already PascalCase name is kept. */
    public static String baseName(String componentName) {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (int i = 0; i < componentName.length(); i++) {
            char c = componentName.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.length() == 0 ? "Component" : sb.toString();
    }

    public static String className(String componentName) {
        return baseName(componentName) + "Component";
    }

    public static String behaviorFile(String componentName) {
        return baseName(componentName) + ".component.ts";
    }

    public static String templateFile(String componentName) {
        return baseName(componentName) + ".component.html";
    }

    public static String styleFile(String componentName) {
        return baseName(componentName) + ".component.css";
    }

    public static String specFile(String componentName) {
        return baseName(componentName) + ".component.spec.ts";
    }
}
