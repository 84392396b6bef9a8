package org.zerox.compiler.frontend.lexer;

import java.util.Set;

/**
 * The fixed word tables of the language.
 */
public final class Keywords {

    /** Words the lexer classifies as {@link TokenType#KEYWORD}. */
    public static final Set<String> RESERVED = Set.of(
            "app", "page", "component", "state", "derived", "prop", "type",
            "fn", "async", "layout", "text", "button", "input", "image",
            "link", "toggle", "select", "if", "elif", "else", "for", "in",
            "show", "hide", "on", "watch", "check", "requires", "ensures",
            "api", "store", "use", "js", "style", "import", "from", "return",
            "mount", "destroy", "await", "true", "false", "null",
            "row", "col", "grid", "stack", "center", "middle", "between", "end",
            "list", "map", "set",
            // data
            "model", "data", "query", "form", "field", "table", "column",
            "submit", "validate", "permission",
            "auth", "login", "signup", "logout", "guard", "role",
            "chart", "stat",
            "realtime", "subscribe",
            "route", "nav", "redirect",
            "upload", "preview",
            "toast", "notify", "modal", "confirm",
            // patterns
            "crud", "roles", "can", "cannot",
            "hero", "features", "pricing", "faq", "testimonials", "footer",
            "search", "filter",
            "social", "profile",
            "pay", "cart",
            "media", "gallery",
            "notification",
            "animate", "gesture", "transition",
            "seo", "a11y",
            "ai", "automation", "trigger", "schedule",
            "dev", "mock", "seed",
            "emit",
            "responsive", "mobile", "desktop", "tablet",
            "breadcrumb",
            "admin",
            "drawer", "command",
            "stats",
            // infrastructure
            "deploy", "env", "docker", "ci", "domain", "cdn", "monitor", "backup",
            // backend
            "endpoint", "middleware", "queue", "cron", "cache", "migrate", "webhook", "storage",
            // testing
            "test", "e2e", "fixture", "snapshot",
            // error and state handling
            "error", "loading", "offline", "retry", "log",
            // i18n
            "i18n", "locale", "rtl"
    );

    /** Words the lexer classifies as {@link TokenType#HTTP_METHOD}. */
    public static final Set<String> HTTP_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");

    /**
     * Keywords that open a construct and therefore never act as an identifier inside an expression.
     * Every other keyword ({@code error}, {@code data}, {@code query}, …) is read as a plain name there.
     */
    public static final Set<String> STRUCTURAL = Set.of(
            "page", "component", "app", "state", "derived", "prop", "type",
            "fn", "async", "layout", "if", "elif", "else", "for",
            "show", "hide", "on", "watch", "check", "requires", "ensures",
            "store", "use", "js", "import", "from", "return",
            "model", "form", "field", "table", "column", "submit",
            "validate", "permission",
            "auth", "guard", "role",
            "chart", "stat", "realtime",
            "route", "nav",
            "upload", "modal",
            "deploy", "env", "docker", "ci", "domain", "cdn", "monitor", "backup",
            "endpoint", "middleware", "queue", "cron", "cache", "migrate", "webhook", "storage",
            "test", "e2e", "mock", "fixture",
            "i18n", "locale", "rtl"
    );

    /** Primitive type names. */
    public static final Set<String> PRIMITIVE_TYPES = Set.of("int", "float", "str", "bool", "date", "time", "datetime");

    private Keywords() {
    }

    public static boolean isStructural(String word) {
        return STRUCTURAL.contains(word);
    }
}
