package org.zerox.compiler.frontend.parser.features.testing;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.ArrayExpr;
import org.zerox.compiler.frontend.parser.ast.expression.IdentifierExpr;
import org.zerox.compiler.frontend.parser.ast.expression.ObjectExpr;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the test declarations.
 */
public class TestingHandlersTest {

    /**
     * Verifies the test type, the name and the body of unit tests, and the defaults.
     */
    @Test
    @Tag("unit")
    void unitTests() {
        // Act
        List<AstNode> ast = Parser.parse(String.join("\n",
                "test integration \"saves user\":",
                "  save(user)",
                "  expect(saved)",
                "test:",
                "  verify()"));

        // Assert
        TestNode first = (TestNode) ast.get(0);
        assertThat(first.testType()).isEqualTo("integration");
        assertThat(first.name()).isEqualTo("saves user");
        assertThat(first.body()).hasSize(2);

        TestNode second = (TestNode) ast.get(1);
        assertThat(second.testType()).isEqualTo("unit");
        assertThat(second.name()).isEqualTo("unnamed");
    }

    /**
     * Verifies that end-to-end steps keep their action, target and optional value.
     */
    @Test
    @Tag("unit")
    void e2eSteps() {
        // Act
        E2eNode scenario = (E2eNode) Parser.parse(String.join("\n",
                "e2e \"login flow\":",
                "  visit \"/login\"",
                "  fill email = \"a@b.c\"",
                "  click \"Sign in\"")).get(0);

        // Assert
        assertThat(scenario.name()).isEqualTo("login flow");
        assertThat(scenario.steps()).extracting(E2eNode.Step::action).containsExactly("visit", "fill", "click");
        E2eNode.Step fill = scenario.steps().get(1);
        assertThat(fill.target()).isInstanceOfSatisfying(IdentifierExpr.class,
                target -> assertThat(target.name()).isEqualTo("email"));
        assertThat(fill.value()).isInstanceOf(StringLiteral.class);
        assertThat(scenario.steps().get(2).value()).isNull();
    }

    /**
     * Verifies that mock routes normalize the method and default the path.
     */
    @Test
    @Tag("unit")
    void mockRoutes() {
        // Act
        MockNode mock = (MockNode) Parser.parse(String.join("\n",
                "mock api:",
                "  GET \"/users\" => [{id: 1}]",
                "  post \"/users\" => {ok: true}")).get(0);

        // Assert
        assertThat(mock.target()).isEqualTo("api");
        assertThat(mock.routes()).extracting(MockNode.Route::method).containsExactly("GET", "POST");
        assertThat(mock.routes().get(0).response()).isInstanceOf(ArrayExpr.class);
        assertThat(mock.routes().get(1).response()).isInstanceOf(ObjectExpr.class);
    }

    /**
     * Verifies that fixture data may be indented below the declaration.
     */
    @Test
    @Tag("unit")
    void fixtureData() {
        FixtureNode fixture = (FixtureNode) Parser.parse("fixture users:\n  [{name: \"Kim\"}]").get(0);

        assertThat(fixture.name()).isEqualTo("users");
        assertThat(fixture.data()).isInstanceOf(ArrayExpr.class);
    }
}
