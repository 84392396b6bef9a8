package org.zerox.compiler.frontend.parser.features.infra;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the deployment and infrastructure declarations.
 */
public class InfraHandlersTest {

    /**
     * Verifies a complete infrastructure section, including the provider-style declarations that
     * take a single colon.
     */
    @Test
    @Tag("unit")
    void parsesInfrastructureSection() {
        // Act
        List<AstNode> ast = Parser.parse(String.join("\n",
                "deploy vercel:",
                "  region: \"icn1\"",
                "docker \"node:20\":",
                "  port: 3000",
                "domain \"example.com\":",
                "  ssl: true",
                "cdn:",
                "  cache: true",
                "monitor:",
                "  dsn: \"x\"",
                "backup weekly:",
                "  keep: 4"));

        // Assert
        assertThat(ast).hasSize(6);
        DeployNode deploy = (DeployNode) ast.get(0);
        assertThat(deploy.provider()).isEqualTo("vercel");
        assertThat(deploy.props().get("region")).isInstanceOfSatisfying(StringLiteral.class,
                region -> assertThat(region.value()).isEqualTo("icn1"));

        assertThat(((DockerNode) ast.get(1)).baseImage()).isEqualTo("node:20");

        DomainNode domain = (DomainNode) ast.get(2);
        assertThat(domain.domain()).isEqualTo("example.com");
        assertThat(domain.props().get("ssl")).isInstanceOf(BooleanLiteral.class);

        assertThat(((CdnNode) ast.get(3)).provider()).isEqualTo("cloudflare");
        assertThat(((MonitorNode) ast.get(4)).provider()).isEqualTo("sentry");
        assertThat(((BackupNode) ast.get(5)).strategy()).isEqualTo("weekly");
    }

    /**
     * Verifies that env variables keep their order and the secret marker.
     */
    @Test
    @Tag("unit")
    void envWithSecrets() {
        // Act
        EnvNode env = (EnvNode) Parser.parse(String.join("\n",
                "env production:",
                "  API_URL = \"api.example.com\"",
                "  secret DB_PASSWORD = \"hunter2\"")).get(0);

        // Assert
        assertThat(env.stage()).isEqualTo("production");
        assertThat(env.vars()).extracting(EnvNode.EnvVar::name).containsExactly("API_URL", "DB_PASSWORD");
        assertThat(env.vars()).extracting(EnvNode.EnvVar::secret).containsExactly(false, true);
    }

    /**
     * Verifies that a variable named {@code secret} is not mistaken for the secret marker.
     */
    @Test
    @Tag("unit")
    void envVariableNamedSecret() {
        EnvNode env = (EnvNode) Parser.parse("env:\n  secret = \"x\"").get(0);

        assertThat(env.stage()).isEqualTo("all");
        assertThat(env.vars()).singleElement().satisfies(variable -> {
            assertThat(variable.name()).isEqualTo("secret");
            assertThat(variable.secret()).isFalse();
        });
    }

    /**
     * Verifies that CI triggers and steps are collected from their respective lines.
     */
    @Test
    @Tag("unit")
    void ciTriggersAndSteps() {
        // Act
        CiNode ci = (CiNode) Parser.parse(String.join("\n",
                "ci github:",
                "  trigger push",
                "  on pull_request",
                "  test = \"npm test\"",
                "  build = \"npm run build\"")).get(0);

        // Assert
        assertThat(ci.provider()).isEqualTo("github");
        assertThat(ci.triggers()).containsExactly("push", "pull_request");
        assertThat(ci.steps()).extracting(CiNode.Step::name).containsExactly("test", "build");
    }
}
