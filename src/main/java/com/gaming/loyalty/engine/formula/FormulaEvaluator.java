package com.gaming.loyalty.engine.formula;

import com.gaming.loyalty.domain.Amounts;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Evaluates reward formulas: decimal arithmetic with {@code + - * /}, parentheses and unary sign over
 * numeric literals and named variables. Variables are matched by whole identifier, so {@code net_loss}
 * never matches inside {@code net_loss_7d}.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := ('+' | '-') factor | NUMBER | IDENTIFIER | '(' expression ')'
 * </pre>
 */
@Component
public class FormulaEvaluator {

    /**
     * @throws FormulaEvaluationException on a syntax error, an unknown variable or division by zero
     */
    public BigDecimal evaluate(String expression, Map<String, BigDecimal> variables) {
        if (expression == null || expression.isBlank()) {
            throw new FormulaEvaluationException("Empty formula");
        }
        Parser parser = new Parser(FormulaTokenizer.tokenize(expression), variables);
        BigDecimal result = parser.expression();
        parser.expect(FormulaToken.Kind.END);
        return result;
    }

    private static final class Parser {

        private final List<FormulaToken> tokens;
        private final Map<String, BigDecimal> variables;
        private int index;

        Parser(List<FormulaToken> tokens, Map<String, BigDecimal> variables) {
            this.tokens = tokens;
            this.variables = variables;
        }

        BigDecimal expression() {
            BigDecimal value = term();
            while (peek().kind() == FormulaToken.Kind.PLUS || peek().kind() == FormulaToken.Kind.MINUS) {
                FormulaToken operator = next();
                BigDecimal right = term();
                value = operator.kind() == FormulaToken.Kind.PLUS
                        ? value.add(right, Amounts.CONTEXT)
                        : value.subtract(right, Amounts.CONTEXT);
            }
            return value;
        }

        private BigDecimal term() {
            BigDecimal value = factor();
            while (peek().kind() == FormulaToken.Kind.STAR || peek().kind() == FormulaToken.Kind.SLASH) {
                FormulaToken operator = next();
                BigDecimal right = factor();
                if (operator.kind() == FormulaToken.Kind.STAR) {
                    value = value.multiply(right, Amounts.CONTEXT);
                } else {
                    if (right.signum() == 0) {
                        throw new FormulaEvaluationException("Division by zero at position " + operator.position());
                    }
                    value = value.divide(right, Amounts.CONTEXT);
                }
            }
            return value;
        }

        private BigDecimal factor() {
            FormulaToken token = next();
            switch (token.kind()) {
                case PLUS:
                    return factor();
                case MINUS:
                    return factor().negate();
                case NUMBER:
                    try {
                        return new BigDecimal(token.text());
                    } catch (NumberFormatException e) {
                        throw new FormulaEvaluationException("Malformed number '" + token.text() + "'", e);
                    }
                case IDENTIFIER:
                    BigDecimal value = variables.get(token.text());
                    if (value == null) {
                        throw new FormulaEvaluationException("Unknown variable '" + token.text() + "'");
                    }
                    return value;
                case LEFT_PAREN:
                    BigDecimal inner = expression();
                    expect(FormulaToken.Kind.RIGHT_PAREN);
                    return inner;
                default:
                    throw new FormulaEvaluationException(
                            "Unexpected '" + token.text() + "' at position " + token.position());
            }
        }

        void expect(FormulaToken.Kind kind) {
            FormulaToken token = next();
            if (token.kind() != kind) {
                throw new FormulaEvaluationException("Expected " + kind + " but found '" + token.text()
                        + "' at position " + token.position());
            }
        }

        private FormulaToken peek() {
            return tokens.get(index);
        }

        private FormulaToken next() {
            FormulaToken token = tokens.get(index);
            if (token.kind() != FormulaToken.Kind.END) {
                index++;
            }
            return token;
        }
    }
}
