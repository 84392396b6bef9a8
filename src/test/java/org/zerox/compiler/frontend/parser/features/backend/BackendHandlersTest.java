package org.zerox.compiler.frontend.parser.features.backend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.ArrayExpr;
import org.zerox.compiler.frontend.parser.ast.expression.NumberLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;
import org.zerox.compiler.frontend.parser.ast.statement.ExpressionStatement;
import org.zerox.compiler.frontend.parser.ast.statement.ReturnStatement;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the server-side declarations.
 */
public class BackendHandlersTest {

    /**
     * Verifies that a lower-case method is normalized, a bare path gets a slash, and middleware
     * and guard are kept apart.
     */
    @Test
    @Tag("unit")
    void endpointWithMiddlewareAndGuard() {
        // Act
        EndpointNode endpoint = (EndpointNode) Parser.parse(String.join("\n",
                "endpoint post users middleware auth middleware rateLimit guard admin:",
                "  return 1")).get(0);

        // Assert
        assertThat(endpoint.method()).isEqualTo("POST");
        assertThat(endpoint.path()).isEqualTo("/users");
        assertThat(endpoint.middleware()).containsExactly("auth", "rateLimit");
        assertThat(endpoint.guard()).isEqualTo("admin");
        assertThat(endpoint.body()).singleElement().isInstanceOf(ReturnStatement.class);
    }

    /**
     * Verifies the defaults of an endpoint without method and path.
     */
    @Test
    @Tag("unit")
    void endpointDefaults() {
        EndpointNode endpoint = (EndpointNode) Parser.parse("endpoint:\n  health()").get(0);

        assertThat(endpoint.method()).isEqualTo("GET");
        assertThat(endpoint.path()).isEqualTo("/");
        assertThat(endpoint.guard()).isNull();
    }

    /**
     * Verifies jobs, caches and storage buckets with their optional settings.
     */
    @Test
    @Tag("unit")
    void jobsCachesAndStorage() {
        // Act
        List<AstNode> ast = Parser.parse(String.join("\n",
                "cron cleanup \"0 3 * * *\":",
                "  purge()",
                "queue emails:",
                "  send(job)",
                "cache users redis:",
                "  ttl: 3600",
                "storage uploads r2:",
                "  bucket: \"files\"",
                "webhook stripe:",
                "  handle(payload)"));

        // Assert
        CronNode cron = (CronNode) ast.get(0);
        assertThat(cron.schedule()).isEqualTo("0 3 * * *");
        assertThat(cron.body()).singleElement().isInstanceOf(ExpressionStatement.class);

        assertThat(((QueueNode) ast.get(1)).name()).isEqualTo("emails");

        CacheNode cache = (CacheNode) ast.get(2);
        assertThat(cache.strategy()).isEqualTo("redis");
        assertThat(cache.ttl()).isInstanceOfSatisfying(NumberLiteral.class,
                ttl -> assertThat(ttl.value()).isEqualTo(3600.0));

        StorageNode storage = (StorageNode) ast.get(3);
        assertThat(storage.provider()).isEqualTo("r2");
        assertThat(storage.props()).containsKey("bucket");

        assertThat(((WebhookNode) ast.get(4)).path()).isEqualTo("/webhooks/stripe");
    }

    /**
     * Verifies that a cron job without a schedule runs hourly and a cache without settings has
     * no ttl.
     */
    @Test
    @Tag("unit")
    void cronAndCacheDefaults() {
        List<AstNode> ast = Parser.parse(String.join("\n",
                "cron tick:",
                "  run()",
                "cache sessions"));

        assertThat(((CronNode) ast.get(0)).schedule()).isEqualTo("0 * * * *");
        CacheNode cache = (CacheNode) ast.get(1);
        assertThat(cache.strategy()).isEqualTo("memory");
        assertThat(cache.ttl()).isNull();
    }

    /**
     * Verifies that migration statements are split by direction and loose statements run up.
     */
    @Test
    @Tag("unit")
    void migrationDirections() {
        // Act
        MigrateNode migration = (MigrateNode) Parser.parse(String.join("\n",
                "migrate addUsers:",
                "  up:",
                "    createTable(\"users\")",
                "    addIndex(\"users\")",
                "  down:",
                "    dropTable(\"users\")",
                "  analyze()")).get(0);

        // Assert
        assertThat(migration.name()).isEqualTo("addUsers");
        assertThat(migration.up()).hasSize(3);
        assertThat(migration.down()).hasSize(1);
    }

    /**
     * Verifies that seed data may follow the colon on the same line or in an indented block.
     */
    @Test
    @Tag("unit")
    void seedDataInlineOrIndented() {
        // Act
        List<AstNode> ast = Parser.parse(String.join("\n",
                "seed User 10:",
                "  [{name: \"Kim\"}, {name: \"Lee\"}]",
                "seed Tag: [\"a\"]"));

        // Assert
        SeedNode users = (SeedNode) ast.get(0);
        assertThat(users.model()).isEqualTo("User");
        assertThat(users.count()).isInstanceOf(NumberLiteral.class);
        assertThat(users.data()).isInstanceOfSatisfying(ArrayExpr.class,
                data -> assertThat(data.elements()).hasSize(2));

        SeedNode tags = (SeedNode) ast.get(1);
        assertThat(tags.count()).isNull();
        assertThat(tags.data()).isInstanceOfSatisfying(ArrayExpr.class,
                data -> assertThat(data.elements()).singleElement().isInstanceOf(StringLiteral.class));
    }
}
