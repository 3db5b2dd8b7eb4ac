package autoexplore.driver;

/**
 * Renders Maestro flow YAML fragments. Shared by the live driver (one-step
 * flows) and the script generator so both address elements identically.
 */
public final class MaestroSteps {

    public static final String WAIT_FOR_ANIMATION = "- waitForAnimationToEnd";
    public static final String BACK               = "- back";

    private MaestroSteps() {}

    /** Flow header: {@code appId: <id>} followed by the document separator. */
    public static String header(String appId) {
        return "appId: " + appId + "\n---\n";
    }

    /** {@code tapOn} step (without trailing newline) for the given locator. */
    public static String tapOn(Locator locator) {
        return switch (locator.getStrategy()) {
            case TEXT, ACCESSIBILITY -> "- tapOn: " + quote(locator.getValue());
            case ID -> "- tapOn:\n    id: " + quote(locator.getValue());
            case POINT -> "- tapOn:\n    point: " + quote(locator.getValue());
        };
    }

    public static String takeScreenshot(String name) {
        return "- takeScreenshot: " + quote(name);
    }

    /** Double-quoted YAML scalar with backslashes, quotes and line breaks escaped. */
    public static String quote(String raw) {
        String s = raw == null ? "" : raw;
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default   -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
