package ai.docsite.plaintext.math;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MathExpressionTest {

    @Test
    void keepsPlainSourceAndRequestedMode() {
        MathExpression expression = MathExpression.parse("x^2", false);

        assertThat(expression.body()).isEqualTo("x^2");
        assertThat(expression.display()).isFalse();
    }

    @Test
    void unwrapsEnvironmentsIntoDisplayMode() {
        MathExpression expression = MathExpression.parse("\\begin{equation*} E = mc^2 \\end{equation*}", false);

        assertThat(expression.body()).isEqualTo(" E = mc^2 ");
        assertThat(expression.display()).isTrue();
    }

    @Test
    void flattensTabularEnvironments() {
        MathExpression expression = MathExpression.parse("\\begin{align}a&=b\\\\c&=d\\end{align}", false);

        assertThat(expression.body()).isEqualTo("a =b\nc =d");
        assertThat(new MathInterpreter().interpret(expression)).isEqualTo("a =b\nc =d");
    }
}
