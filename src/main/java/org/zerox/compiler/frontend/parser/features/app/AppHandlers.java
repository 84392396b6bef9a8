package org.zerox.compiler.frontend.parser.features.app;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handlers for application-wide declarations: authentication, routes, roles, automation and
 * development settings, plus the <code>nav</code> UI element.
 */
public final class AppHandlers {

    /** Block keywords that never name a role. */
    private static final Set<String> NON_ROLE_KEYWORDS = Set.of("validate", "permission", "data", "form", "table");

    private AppHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.TOP_LEVEL, "auth", AppHandlers::parseAuth);
        registry.register(KeywordScope.TOP_LEVEL, "route", AppHandlers::parseRoute);
        registry.register(KeywordScope.TOP_LEVEL, "roles", AppHandlers::parseRoles);
        registry.register(KeywordScope.TOP_LEVEL, "automation", AppHandlers::parseAutomation);
        registry.register(KeywordScope.TOP_LEVEL, "dev", AppHandlers::parseDev);
        registry.register(KeywordScope.UI, "nav", AppHandlers::parseNav);
    }

    /**
     * Parses an authentication block.
     * Expected format:
     * <pre>
     * auth provider="supabase":
     *   login: email, password
     *   signup: email, password, name
     *   logout
     *   guard: admin -&gt; redirect("/login")
     * </pre>
     */
    static AuthDeclNode parseAuth(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "auth").location();
        String provider = "custom";
        if (context.checkWord("provider")) {
            context.advance();
            context.expect(TokenType.OPERATOR, "=");
            provider = context.expect(TokenType.STRING).value();
        }
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<String> loginFields = new ArrayList<>();
        List<String> signupFields = new ArrayList<>();
        List<AuthDeclNode.Guard> guards = new ArrayList<>();
        boolean[] logout = {false};
        context.forEachBlockLine(() -> {
            if (context.match(TokenType.KEYWORD, "login")) {
                context.expect(TokenType.PUNCTUATION, ":");
                loginFields.addAll(context.parseNameList());
            } else if (context.match(TokenType.KEYWORD, "signup")) {
                context.expect(TokenType.PUNCTUATION, ":");
                signupFields.addAll(context.parseNameList());
            } else if (context.match(TokenType.KEYWORD, "logout")) {
                logout[0] = true;
            } else if (context.match(TokenType.KEYWORD, "guard")) {
                context.expect(TokenType.PUNCTUATION, ":");
                guards.add(parseGuard(context));
            } else {
                context.skipLine();
            }
        });
        return new AuthDeclNode(location, provider, loginFields, signupFields, logout[0], guards);
    }

    private static AuthDeclNode.Guard parseGuard(ParsingContext context) {
        String role = context.expectName();
        String redirect = null;
        if (context.match(TokenType.OPERATOR, "->")) {
            if (context.checkWord("redirect")) {
                context.advance();
                context.expect(TokenType.PUNCTUATION, "(");
                redirect = context.expect(TokenType.STRING).value();
                context.expect(TokenType.PUNCTUATION, ")");
            } else {
                redirect = context.expect(TokenType.STRING).value();
            }
        }
        return new AuthDeclNode.Guard(role, redirect);
    }


    static RouteDeclNode parseRoute(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "route").location();
        String path = context.expect(TokenType.STRING).value();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        String[] target = {""};
        String[] guard = {null};
        context.forEachBlockLine(() -> {
            if (context.match(TokenType.KEYWORD, "page")) {
                target[0] = context.expectName();
            } else if (context.match(TokenType.KEYWORD, "guard")) {
                context.expect(TokenType.PUNCTUATION, ":");
                guard[0] = context.expectName();
            } else {
                context.skipLine();
            }
        });
        return new RouteDeclNode(location, path, target[0], guard[0]);
    }

    static RoleDeclNode parseRoles(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "roles").location();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<RoleDeclNode.Role> roles = new ArrayList<>();
        context.forEachBlockLine(() -> {
            if (!context.checkWord() || NON_ROLE_KEYWORDS.contains(context.peek().value())) {
                context.skipLine();
                return;
            }
            String name = context.expectName();
            List<String> can = new ArrayList<>();
            if (context.match(TokenType.PUNCTUATION, ":")) {
                context.skipNewlines();
                context.forEachBlockLine(() -> {
                    if (context.checkWord("can") && context.peek(1).is(TokenType.PUNCTUATION, ":")) {
                        context.advance();
                        context.advance();
                        can.addAll(context.parseNameList());
                    } else {
                        context.skipLine();
                    }
                });
            }
            roles.add(new RoleDeclNode.Role(name, List.of(), can));
        });
        return new RoleDeclNode(location, roles);
    }

    /**
     * Parses an automation block.
     * Expected format:
     * <pre>
     * automation:
     *   trigger "user.signup"
     *     sendWelcome(user)
     *   schedule "0 9 * * 1"
     *     sendReport()
     * </pre>
     */
    static AutomationNode parseAutomation(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "automation").location();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<AutomationNode.Trigger> triggers = new ArrayList<>();
        List<AutomationNode.Schedule> schedules = new ArrayList<>();
        context.forEachBlockLine(() -> {
            if (context.match(TokenType.KEYWORD, "trigger")) {
                String event = context.check(TokenType.STRING) ? context.advance().value() : context.expectName();
                triggers.add(new AutomationNode.Trigger(event, parseActions(context)));
            } else if (context.match(TokenType.KEYWORD, "schedule")) {
                String cron = context.check(TokenType.STRING) ? context.advance().value() : "* * * * *";
                schedules.add(new AutomationNode.Schedule(cron, parseActions(context)));
            } else {
                context.skipLine();
            }
        });
        return new AutomationNode(location, triggers, schedules);
    }

    private static List<Expression> parseActions(ParsingContext context) {
        context.skipNewlines();
        List<Expression> actions = new ArrayList<>();
        context.forEachBlockLine(() -> actions.add(context.parseExpression()));
        return actions;
    }

    static DevNode parseDev(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "dev").location();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return new DevNode(location, context.parsePropsBlock());
    }

    /**
     * Expected format: {@code nav [props]:} followed by {@code link "Label" [href="/path"] [icon="name"]}
     * lines. Other lines are skipped.
     */
    static NavNode parseNav(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "nav").location();
        Map<String, Expression> props = Props.builder();
        while (context.checkWord()) {
            SourceLocation keyLocation = context.location();
            String key = context.advance().value();
            if (context.match(TokenType.OPERATOR, "=")) {
                props.put(key, context.parseAtomicExpression());
            } else {
                props.put(key, new BooleanLiteral(keyLocation, true));
            }
        }
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<NavNode.NavItem> items = new ArrayList<>();
        context.forEachBlockLine(() -> {
            if (!context.match(TokenType.KEYWORD, "link")) {
                context.skipLine();
                return;
            }
            String label = context.expect(TokenType.STRING).value();
            String href = "#";
            String icon = null;
            while (context.checkWord()) {
                String key = context.advance().value();
                if (!context.match(TokenType.OPERATOR, "=")) {
                    continue;
                }
                String value = context.expect(TokenType.STRING).value();
                if (key.equals("href")) {
                    href = value;
                } else if (key.equals("icon")) {
                    icon = value;
                }
            }
            items.add(new NavNode.NavItem(label, href, icon));
        });
        return new NavNode(location, items, props);
    }
}
