package org.zerox.compiler.frontend.parser.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of AST node kinds.
 * <p>
 * Each kind carries the discriminant string used in tooling output ({@code "Page"},
 * {@code "StateDecl"}, {@code "binary"}, …) and the family it belongs to.
 */
public enum NodeKind {

    // region Declarations
    PAGE("Page", Family.DECLARATION),
    COMPONENT("Component", Family.DECLARATION),
    APP("App", Family.DECLARATION),
    STATE_DECL("StateDecl", Family.DECLARATION),
    DERIVED_DECL("DerivedDecl", Family.DECLARATION),
    PROP_DECL("PropDecl", Family.DECLARATION),
    TYPE_DECL("TypeDecl", Family.DECLARATION),
    STORE_DECL("StoreDecl", Family.DECLARATION),
    API_DECL("ApiDecl", Family.DECLARATION),
    FN_DECL("FnDecl", Family.DECLARATION),
    ON_MOUNT("OnMount", Family.DECLARATION),
    ON_DESTROY("OnDestroy", Family.DECLARATION),
    WATCH_BLOCK("WatchBlock", Family.DECLARATION),
    CHECK_DECL("CheckDecl", Family.DECLARATION),
    STYLE_DECL("StyleDecl", Family.DECLARATION),
    JS_IMPORT("JsImport", Family.DECLARATION),
    JS_BLOCK("JsBlock", Family.DECLARATION),
    USE_IMPORT("UseImport", Family.DECLARATION),
    MODEL("Model", Family.DECLARATION),
    DATA_DECL("DataDecl", Family.DECLARATION),
    FORM_DECL("FormDecl", Family.DECLARATION),
    AUTH_DECL("AuthDecl", Family.DECLARATION),
    REALTIME_DECL("RealtimeDecl", Family.DECLARATION),
    ROUTE_DECL("RouteDecl", Family.DECLARATION),
    ROLE_DECL("RoleDecl", Family.DECLARATION),
    AUTOMATION("Automation", Family.DECLARATION),
    DEV("Dev", Family.DECLARATION),
    DEPLOY("Deploy", Family.DECLARATION),
    ENV("Env", Family.DECLARATION),
    DOCKER("Docker", Family.DECLARATION),
    CI("Ci", Family.DECLARATION),
    DOMAIN("Domain", Family.DECLARATION),
    CDN("Cdn", Family.DECLARATION),
    MONITOR("Monitor", Family.DECLARATION),
    BACKUP("Backup", Family.DECLARATION),
    ENDPOINT("Endpoint", Family.DECLARATION),
    MIDDLEWARE("Middleware", Family.DECLARATION),
    QUEUE("Queue", Family.DECLARATION),
    CRON("Cron", Family.DECLARATION),
    CACHE("Cache", Family.DECLARATION),
    MIGRATE("Migrate", Family.DECLARATION),
    SEED("Seed", Family.DECLARATION),
    WEBHOOK("Webhook", Family.DECLARATION),
    STORAGE("Storage", Family.DECLARATION),
    TEST("Test", Family.DECLARATION),
    E2E("E2e", Family.DECLARATION),
    MOCK("Mock", Family.DECLARATION),
    FIXTURE("Fixture", Family.DECLARATION),
    ERROR("Error", Family.DECLARATION),
    LOADING("Loading", Family.DECLARATION),
    OFFLINE("Offline", Family.DECLARATION),
    RETRY("Retry", Family.DECLARATION),
    LOG("Log", Family.DECLARATION),
    I18N("I18n", Family.DECLARATION),
    LOCALE("Locale", Family.DECLARATION),
    RTL("Rtl", Family.DECLARATION),
    // endregion

    // region UI
    LAYOUT("Layout", Family.UI),
    TEXT("Text", Family.UI),
    BUTTON("Button", Family.UI),
    INPUT("Input", Family.UI),
    IMAGE("Image", Family.UI),
    LINK("Link", Family.UI),
    TOGGLE("Toggle", Family.UI),
    SELECT("Select", Family.UI),
    COMPONENT_CALL("ComponentCall", Family.UI),
    IF_BLOCK("IfBlock", Family.UI),
    FOR_BLOCK("ForBlock", Family.UI),
    SHOW_BLOCK("ShowBlock", Family.UI),
    HIDE_BLOCK("HideBlock", Family.UI),
    TABLE("Table", Family.UI),
    CHART("Chart", Family.UI),
    STAT("Stat", Family.UI),
    STATS_GRID("StatsGrid", Family.UI),
    NAV("Nav", Family.UI),
    UPLOAD("Upload", Family.UI),
    MODAL("Modal", Family.UI),
    TOAST("Toast", Family.UI),
    EMIT("Emit", Family.UI),
    CRUD("Crud", Family.UI),
    LIST("List", Family.UI),
    DRAWER("Drawer", Family.UI),
    COMMAND("Command", Family.UI),
    CONFIRM("Confirm", Family.UI),
    PAY("Pay", Family.UI),
    CART("Cart", Family.UI),
    MEDIA("Media", Family.UI),
    NOTIFICATION("Notification", Family.UI),
    SEARCH("Search", Family.UI),
    FILTER("Filter", Family.UI),
    SOCIAL("Social", Family.UI),
    PROFILE("Profile", Family.UI),
    HERO("Hero", Family.UI),
    FEATURES("Features", Family.UI),
    PRICING("Pricing", Family.UI),
    FAQ("Faq", Family.UI),
    TESTIMONIAL("Testimonial", Family.UI),
    FOOTER("Footer", Family.UI),
    ADMIN("Admin", Family.UI),
    SEO("Seo", Family.UI),
    A11Y("A11y", Family.UI),
    ANIMATE("Animate", Family.UI),
    GESTURE("Gesture", Family.UI),
    AI("Ai", Family.UI),
    RESPONSIVE("Responsive", Family.UI),
    BREADCRUMB("Breadcrumb", Family.UI),
    // endregion

    // region Expressions
    NUMBER("number", Family.EXPRESSION),
    STRING("string", Family.EXPRESSION),
    BOOLEAN("boolean", Family.EXPRESSION),
    NULL("null", Family.EXPRESSION),
    IDENTIFIER("identifier", Family.EXPRESSION),
    MEMBER("member", Family.EXPRESSION),
    INDEX("index", Family.EXPRESSION),
    CALL("call", Family.EXPRESSION),
    BINARY("binary", Family.EXPRESSION),
    UNARY("unary", Family.EXPRESSION),
    TERNARY("ternary", Family.EXPRESSION),
    ARROW("arrow", Family.EXPRESSION),
    ARRAY("array", Family.EXPRESSION),
    OBJECT_EXPR("object_expr", Family.EXPRESSION),
    TEMPLATE("template", Family.EXPRESSION),
    ASSIGNMENT("assignment", Family.EXPRESSION),
    AWAIT("await", Family.EXPRESSION),
    OLD("old", Family.EXPRESSION),
    BRACED("braced", Family.EXPRESSION),
    // endregion

    // region Statements
    EXPR_STMT("expr_stmt", Family.STATEMENT),
    RETURN("return", Family.STATEMENT),
    IF_STMT("if_stmt", Family.STATEMENT),
    FOR_STMT("for_stmt", Family.STATEMENT),
    VAR_DECL("var_decl", Family.STATEMENT),
    ASSIGNMENT_STMT("assignment_stmt", Family.STATEMENT),
    // endregion

    // region Type expressions
    PRIMITIVE_TYPE("primitive", Family.TYPE),
    LIST_TYPE("list", Family.TYPE),
    MAP_TYPE("map", Family.TYPE),
    SET_TYPE("set", Family.TYPE),
    OBJECT_TYPE("object", Family.TYPE),
    UNION_TYPE("union", Family.TYPE),
    NULLABLE_TYPE("nullable", Family.TYPE),
    NAMED_TYPE("named", Family.TYPE),
    // endregion

    // region Support
    COMMENT("Comment", Family.SUPPORT);
    // endregion

    /**
     * The broad family of a node kind.
     */
    public enum Family {
        /** Containers and body-level declarations. */
        DECLARATION,
        /** Renderable elements and UI control flow. */
        UI,
        EXPRESSION,
        STATEMENT,
        TYPE,
        /** Nodes kept for tooling only, such as comments. */
        SUPPORT
    }

    private static final Map<String, NodeKind> BY_DISCRIMINANT = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeKind::discriminant, Function.identity()));

    private final String discriminant;
    private final Family family;

    NodeKind(String discriminant, Family family) {
        this.discriminant = discriminant;
        this.family = family;
    }

    public String discriminant() {
        return discriminant;
    }

    public Family family() {
        return family;
    }

    /**
     * @param discriminant A discriminant string such as {@code "Page"}.
     * @return The matching kind, if any.
     */
    public static Optional<NodeKind> fromDiscriminant(String discriminant) {
        return Optional.ofNullable(BY_DISCRIMINANT.get(discriminant));
    }
}
