package org.zerox.compiler.frontend.parser.features.pattern;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.GenericBlock;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.expression.NullLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handlers for the high-level UI patterns. Each pattern expands into a complete, conventional
 * piece of interface (a CRUD screen, a pricing table, a command palette) from a one-line
 * declaration plus optional properties.
 * <p>
 * Most patterns accept an optional variant word directly after the keyword. A missing or unknown
 * variant falls back to the pattern's default and leaves the token for the next rule.
 */
public final class PatternHandlers {

    private static final Set<String> LIST_TYPES = Set.of("grid", "timeline", "kanban", "tree", "virtual");
    private static final Set<String> PAY_TYPES = Set.of("checkout", "pricing", "portal", "buyButton");
    private static final Set<String> MEDIA_TYPES = Set.of("gallery", "video", "audio", "carousel");
    private static final Set<String> NOTIFICATION_TYPES = Set.of("center", "push", "email");
    private static final Set<String> SEARCH_TYPES = Set.of("global", "inline");
    private static final Set<String> SOCIAL_TYPES = Set.of("like", "bookmark", "comments", "follow", "share", "feed");
    private static final Set<String> ADMIN_TYPES = Set.of("dashboard", "cms");
    private static final Set<String> ANIMATION_TYPES = Set.of("enter", "exit", "scroll", "count", "type", "confetti");
    private static final Set<String> GESTURE_TYPES = Set.of("drag", "pinch", "longPress", "doubleTap", "swipe");
    private static final Set<String> AI_TYPES =
            Set.of("generate", "chat", "search", "vision", "recommend", "translate", "summarize");
    private static final Set<String> BREAKPOINT_KEYWORDS = Set.of("mobile", "tablet", "desktop");

    private PatternHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.UI, "crud", PatternHandlers::parseCrud);
        registry.register(KeywordScope.UI, "list", PatternHandlers::parseList);
        registry.register(KeywordScope.UI, "drawer", PatternHandlers::parseDrawer);
        registry.register(KeywordScope.UI, "command", PatternHandlers::parseCommand);
        registry.register(KeywordScope.UI, "confirm", PatternHandlers::parseConfirm);
        registry.register(KeywordScope.UI, "pay", PatternHandlers::parsePay);
        registry.register(KeywordScope.UI, "cart", PatternHandlers::parseCart);
        registry.register(KeywordScope.UI, "media", PatternHandlers::parseMedia);
        registry.register(KeywordScope.UI, "gallery", PatternHandlers::parseMedia);
        registry.register(KeywordScope.UI, "notification", PatternHandlers::parseNotification);
        registry.register(KeywordScope.UI, "search", PatternHandlers::parseSearch);
        registry.register(KeywordScope.UI, "filter", PatternHandlers::parseFilter);
        registry.register(KeywordScope.UI, "social", PatternHandlers::parseSocial);
        registry.register(KeywordScope.UI, "profile", PatternHandlers::parseProfile);
        registry.register(KeywordScope.UI, "hero", PatternHandlers::parseHero);
        registry.register(KeywordScope.UI, "features", PatternHandlers::parseFeatures);
        registry.register(KeywordScope.UI, "pricing", PatternHandlers::parsePricing);
        registry.register(KeywordScope.UI, "faq", PatternHandlers::parseFaq);
        registry.register(KeywordScope.UI, "testimonials", PatternHandlers::parseTestimonials);
        registry.register(KeywordScope.UI, "footer", PatternHandlers::parseFooter);
        registry.register(KeywordScope.UI, "admin", PatternHandlers::parseAdmin);
        registry.register(KeywordScope.UI, "seo", PatternHandlers::parseSeo);
        registry.register(KeywordScope.UI, "a11y", PatternHandlers::parseA11y);
        registry.register(KeywordScope.UI, "animate", PatternHandlers::parseAnimate);
        registry.register(KeywordScope.UI, "gesture", PatternHandlers::parseGesture);
        registry.register(KeywordScope.UI, "ai", PatternHandlers::parseAi);
        registry.register(KeywordScope.UI, "breadcrumb", PatternHandlers::parseBreadcrumb);
        registry.register(KeywordScope.UI, "responsive", PatternHandlers::parseResponsive);
        registry.register(KeywordScope.UI, "mobile", PatternHandlers::parseResponsive);
        registry.register(KeywordScope.UI, "desktop", PatternHandlers::parseResponsive);
        registry.register(KeywordScope.UI, "tablet", PatternHandlers::parseResponsive);
    }

    /**
     * Consumes the current word if it is one of {@code variants}.
     *
     * @return The consumed variant, or {@code fallback} if the current token is not a variant.
     */
    private static String variant(ParsingContext context, Set<String> variants, String fallback) {
        if (context.checkWord() && variants.contains(context.peek().value())) {
            return context.advance().value();
        }
        return fallback;
    }

    private static SourceLocation keyword(ParsingContext context, String keyword) {
        return context.expect(TokenType.KEYWORD, keyword).location();
    }

    // region collections

    static CrudNode parseCrud(ParsingContext context) {
        SourceLocation location = keyword(context, "crud");
        String model = context.expectName();
        GenericBlock block = context.parseGenericBlock();
        return new CrudNode(location, model, block.props(), block.body());
    }

    static ListNode parseList(ParsingContext context) {
        SourceLocation location = keyword(context, "list");
        String listType = variant(context, LIST_TYPES, "grid");
        Expression dataSource = context.parseExpression();
        GenericBlock block = context.parseGenericBlock();
        return new ListNode(location, listType, dataSource, block.props(), block.body());
    }

    static SearchNode parseSearch(ParsingContext context) {
        SourceLocation location = keyword(context, "search");
        String searchType = variant(context, SEARCH_TYPES, "global");
        String target = "";
        if (context.checkWord() && !context.peek(1).is(TokenType.OPERATOR, "=")) {
            target = context.advance().value();
        }
        GenericBlock block = context.parseGenericBlock();
        return new SearchNode(location, searchType, target, block.props(), block.body());
    }

    static FilterNode parseFilter(ParsingContext context) {
        SourceLocation location = keyword(context, "filter");
        String target = context.expectName();
        return new FilterNode(location, target, context.parseGenericPropsBlock());
    }

    // endregion

    // region overlays

    static DrawerNode parseDrawer(ParsingContext context) {
        SourceLocation location = keyword(context, "drawer");
        String name = context.expectName();
        GenericBlock block = context.parseGenericBlock();
        return new DrawerNode(location, name, block.props(), block.body());
    }

    static CommandNode parseCommand(ParsingContext context) {
        SourceLocation location = keyword(context, "command");
        String shortcut = "ctrl+k";
        if (context.check(TokenType.STRING)) {
            shortcut = context.advance().value();
        }
        return new CommandNode(location, shortcut, context.parseGenericPropsBlock());
    }

    /**
     * Expected format: {@code confirm "message" [danger] [confirm="..."] [cancel="..."] [description="..."]}.
     */
    static ConfirmNode parseConfirm(ParsingContext context) {
        SourceLocation location = keyword(context, "confirm");
        String message = context.expect(TokenType.STRING).value();
        String description = null;
        String confirmLabel = "Confirm";
        String cancelLabel = "Cancel";
        boolean danger = false;
        while (context.checkWord()) {
            String key = context.advance().value();
            if (key.equals("danger")) {
                danger = true;
                continue;
            }
            if (!context.match(TokenType.OPERATOR, "=")) {
                continue;
            }
            String value = context.expect(TokenType.STRING).value();
            switch (key) {
                case "confirm" -> confirmLabel = value;
                case "cancel" -> cancelLabel = value;
                case "description" -> description = value;
                default -> {
                    // only the labels and the description are configurable
                }
            }
        }
        return new ConfirmNode(location, message, description, confirmLabel, cancelLabel, danger);
    }

    static NotificationNode parseNotification(ParsingContext context) {
        SourceLocation location = keyword(context, "notification");
        String notificationType = variant(context, NOTIFICATION_TYPES, "center");
        return new NotificationNode(location, notificationType, context.parseGenericPropsBlock());
    }

    // endregion

    // region commerce

    static PayNode parsePay(ParsingContext context) {
        SourceLocation location = keyword(context, "pay");
        String payType = variant(context, PAY_TYPES, "checkout");
        GenericBlock block = context.parseGenericBlock();
        String provider = block.props().get("provider") instanceof StringLiteral string ? string.value() : "stripe";
        return new PayNode(location, provider, payType, block.props(), block.body());
    }

    static CartNode parseCart(ParsingContext context) {
        return new CartNode(keyword(context, "cart"), context.parseGenericPropsBlock());
    }

    // endregion

    // region media and social

    /**
     * Expected format: {@code media [gallery|video|audio|carousel] src [props]} or
     * {@code gallery src [props]}.
     */
    static MediaNode parseMedia(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD).location();
        String mediaType = variant(context, MEDIA_TYPES, "gallery");
        Expression src = context.parseExpression();
        Map<String, Expression> props = context.parseInlinePropsUntilArrow();
        return new MediaNode(location, mediaType, src, props);
    }

    static SocialNode parseSocial(ParsingContext context) {
        SourceLocation location = keyword(context, "social");
        String socialType = variant(context, SOCIAL_TYPES, "like");
        Expression target = context.parseExpression();
        GenericBlock block = context.parseGenericBlock();
        return new SocialNode(location, socialType, target, block.props(), block.body());
    }

    static ProfileNode parseProfile(ParsingContext context) {
        SourceLocation location = keyword(context, "profile");
        Expression user = context.parseExpression();
        GenericBlock block = context.parseGenericBlock();
        return new ProfileNode(location, user, block.props(), block.body());
    }

    // endregion

    // region landing page sections

    static HeroNode parseHero(ParsingContext context) {
        SourceLocation location = keyword(context, "hero");
        GenericBlock block = context.parseGenericBlock();
        return new HeroNode(location, block.props(), block.body());
    }

    static FeaturesNode parseFeatures(ParsingContext context) {
        return new FeaturesNode(keyword(context, "features"), context.parseGenericPropsBlock());
    }

    static PricingNode parsePricing(ParsingContext context) {
        return new PricingNode(keyword(context, "pricing"), context.parseGenericPropsBlock());
    }

    static FaqNode parseFaq(ParsingContext context) {
        return new FaqNode(keyword(context, "faq"), context.parseGenericPropsBlock());
    }

    static TestimonialsNode parseTestimonials(ParsingContext context) {
        return new TestimonialsNode(keyword(context, "testimonials"), context.parseGenericPropsBlock());
    }

    static FooterNode parseFooter(ParsingContext context) {
        return new FooterNode(keyword(context, "footer"), context.parseGenericPropsBlock());
    }

    // endregion

    static AdminNode parseAdmin(ParsingContext context) {
        SourceLocation location = keyword(context, "admin");
        String adminType = variant(context, ADMIN_TYPES, "dashboard");
        GenericBlock block = context.parseGenericBlock();
        return new AdminNode(location, adminType, block.props(), block.body());
    }

    static SeoNode parseSeo(ParsingContext context) {
        return new SeoNode(keyword(context, "seo"), context.parseGenericPropsBlock());
    }

    static A11yNode parseA11y(ParsingContext context) {
        return new A11yNode(keyword(context, "a11y"), context.parseGenericPropsBlock());
    }

    // region interaction

    static AnimateNode parseAnimate(ParsingContext context) {
        SourceLocation location = keyword(context, "animate");
        String animationType = variant(context, ANIMATION_TYPES, "enter");
        GenericBlock block = context.parseGenericBlock();
        return new AnimateNode(location, animationType, block.props(), block.body());
    }

    /**
     * Expected format: {@code gesture [kind] target [-> action]}.
     */
    static GestureNode parseGesture(ParsingContext context) {
        SourceLocation location = keyword(context, "gesture");
        String gestureType = variant(context, GESTURE_TYPES, "drag");
        Expression target = context.parseExpression();
        Expression action = new NullLiteral(location);
        if (context.match(TokenType.OPERATOR, "->")) {
            action = context.parseExpression();
        }
        return new GestureNode(location, gestureType, target, action);
    }

    /**
     * Expected format: {@code ai[.capability] [capability] [props][:]}.
     */
    static AiNode parseAi(ParsingContext context) {
        SourceLocation location = keyword(context, "ai");
        String aiType = "chat";
        if (context.match(TokenType.PUNCTUATION, ".")) {
            aiType = context.expectName();
        } else {
            aiType = variant(context, AI_TYPES, aiType);
        }
        GenericBlock block = context.parseGenericBlock();
        return new AiNode(location, aiType, block.props(), block.body());
    }

    // endregion

    static BreadcrumbNode parseBreadcrumb(ParsingContext context) {
        return new BreadcrumbNode(keyword(context, "breadcrumb"), context.parseInlineProps());
    }

    /**
     * Expected format: {@code responsive breakpoint [show|hide][:]} or
     * {@code mobile|tablet|desktop [show|hide][:]}, followed by an optional UI block.
     */
    static ResponsiveNode parseResponsive(ParsingContext context) {
        Token token = context.expect(TokenType.KEYWORD);
        String breakpoint = BREAKPOINT_KEYWORDS.contains(token.value()) ? token.value() : context.expectName();
        String action = "show";
        if (context.checkWord("show") || context.checkWord("hide")) {
            action = context.advance().value();
        }
        List<AstNode> body = List.of();
        if (context.match(TokenType.PUNCTUATION, ":")) {
            context.skipNewlines();
            body = context.parseUiBlock();
        }
        return new ResponsiveNode(token.location(), breakpoint, action, body);
    }
}
