package org.zerox.compiler.frontend.parser.features.app;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.features.container.PageNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the application-level declarations.
 */
public class AppHandlersTest {

    /**
     * Verifies the provider, the field lists, the logout flag and the guards of an auth block.
     */
    @Test
    @Tag("unit")
    void authBlock() {
        // Act
        AuthDeclNode auth = (AuthDeclNode) Parser.parse(String.join("\n",
                "auth provider=\"supabase\":",
                "  login: email, password",
                "  signup: email, password, name",
                "  logout",
                "  guard: admin -> redirect(\"/login\")",
                "  guard: member")).get(0);

        // Assert
        assertThat(auth.provider()).isEqualTo("supabase");
        assertThat(auth.loginFields()).containsExactly("email", "password");
        assertThat(auth.signupFields()).containsExactly("email", "password", "name");
        assertThat(auth.logout()).isTrue();
        assertThat(auth.guards()).containsExactly(
                new AuthDeclNode.Guard("admin", "/login"),
                new AuthDeclNode.Guard("member", null));
    }

    /**
     * Verifies that an auth block without logout line leaves the flag unset.
     */
    @Test
    @Tag("unit")
    void authDefaults() {
        AuthDeclNode auth = (AuthDeclNode) Parser.parse("auth:\n  login: email").get(0);

        assertThat(auth.provider()).isEqualTo("custom");
        assertThat(auth.logout()).isFalse();
    }

    /**
     * Verifies that field and permission lists accept names separated by spaces only.
     */
    @Test
    @Tag("unit")
    void nameListsWithoutCommas() {
        // Act
        List<AstNode> ast = Parser.parse(String.join("\n",
                "auth:",
                "  login: email password",
                "  signup: email, password name",
                "roles:",
                "  admin:",
                "    can: read write delete"));

        // Assert
        AuthDeclNode auth = (AuthDeclNode) ast.get(0);
        assertThat(auth.loginFields()).containsExactly("email", "password");
        assertThat(auth.signupFields()).containsExactly("email", "password", "name");
        RoleDeclNode roles = (RoleDeclNode) ast.get(1);
        assertThat(roles.roles().get(0).can()).containsExactly("read", "write", "delete");
    }

    /**
     * Verifies route targets and guards, and role permissions.
     */
    @Test
    @Tag("unit")
    void routesAndRoles() {
        // Act
        List<AstNode> ast = Parser.parse(String.join("\n",
                "route \"/admin\":",
                "  page Dashboard",
                "  guard: admin",
                "roles:",
                "  admin:",
                "    can: read, write, delete",
                "  viewer:",
                "    can: read"));

        // Assert
        assertThat(ast.get(0)).isEqualTo(new RouteDeclNode(ast.get(0).location(), "/admin", "Dashboard", "admin"));
        RoleDeclNode roles = (RoleDeclNode) ast.get(1);
        assertThat(roles.roles()).extracting(RoleDeclNode.Role::name).containsExactly("admin", "viewer");
        assertThat(roles.roles().get(0).can()).containsExactly("read", "write", "delete");
    }

    /**
     * Verifies automation triggers and schedules with their actions.
     */
    @Test
    @Tag("unit")
    void automation() {
        // Act
        AutomationNode automation = (AutomationNode) Parser.parse(String.join("\n",
                "automation:",
                "  trigger \"user.signup\"",
                "    sendWelcome(user)",
                "    track(\"signup\")",
                "  schedule \"0 9 * * 1\"",
                "    sendReport()")).get(0);

        // Assert
        assertThat(automation.triggers()).singleElement().satisfies(trigger -> {
            assertThat(trigger.event()).isEqualTo("user.signup");
            assertThat(trigger.actions()).hasSize(2);
        });
        assertThat(automation.schedules()).singleElement().satisfies(schedule ->
                assertThat(schedule.cron()).isEqualTo("0 9 * * 1"));
    }

    /**
     * Verifies nav props and links with their defaults.
     */
    @Test
    @Tag("unit")
    void navLinks() {
        // Act
        PageNode page = (PageNode) Parser.parse(String.join("\n",
                "page Home:",
                "  nav sticky:",
                "    link \"Home\" href=\"/\" icon=\"home\"",
                "    link \"About\"")).get(0);

        // Assert
        NavNode nav = (NavNode) page.body().get(0);
        assertThat(nav.props().get("sticky")).isInstanceOf(BooleanLiteral.class);
        assertThat(nav.items()).containsExactly(
                new NavNode.NavItem("Home", "/", "home"),
                new NavNode.NavItem("About", "#", null));
    }

    /**
     * Verifies that dev settings are read as a props block.
     */
    @Test
    @Tag("unit")
    void devSettings() {
        DevNode dev = (DevNode) Parser.parse("dev:\n  port: 3000\n  open: true").get(0);

        assertThat(dev.props()).containsOnlyKeys("port", "open");
    }
}
