/*
 * This file is part of JROBDD.
 * Copyright (c) 2023 The JROBDD authors.
 *
 * JROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Precedence climbing parser for propositional formulas.
 *
 * <p>Binary operators, from weakest to strongest: {@code <->}, {@code ->}, {@code |}, {@code ^},
 * {@code &}. Implication and equivalence associate to the right, all other binary operators to the
 * left. Negation binds stronger than every binary operator.</p>
 */
public final class FormulaParser {
    /* Operands of a negation are parsed above the strongest binary operator */
    private static final int NOT_OPERAND_PRECEDENCE = Token.Type.AND.precedence() + 1;

    private final List<Token> tokens;
    private int index = 0;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Formula parse(String formula) throws FormulaParseException {
        return parse(Tokenizer.tokenize(formula));
    }

    public static Formula parse(List<Token> tokens) throws SyntaxException {
        FormulaParser parser = new FormulaParser(tokens);
        Formula result = parser.parseExpression(0, 1);
        if (parser.index != tokens.size()) {
            Token trailing = tokens.get(parser.index);
            String remainder = tokens.subList(parser.index, tokens.size()).stream()
                    .map(Token::text)
                    .collect(Collectors.joining(" "));
            throw new SyntaxException(
                    String.format("trailing input at %d: %s", trailing.position(), remainder), trailing.position());
        }
        return result;
    }

    private Formula parseExpression(int minimumPrecedence, int nesting) throws SyntaxException {
        if (index >= tokens.size()) {
            throw new SyntaxException("unexpected end of input", -1);
        }

        Token token = tokens.get(index);
        checkDepth(nesting, token);
        index += 1;

        Formula left;
        switch (token.type()) {
            case NOT:
                left = Formula.not(parseExpression(NOT_OPERAND_PRECEDENCE, nesting + 1));
                break;
            case LEFT_PARENTHESIS:
                left = parseExpression(0, nesting + 1);
                if (index >= tokens.size() || tokens.get(index).type() != Token.Type.RIGHT_PARENTHESIS) {
                    throw new SyntaxException(
                            String.format("unterminated group opened at %d", token.position()), token.position());
                }
                index += 1;
                break;
            case IDENTIFIER:
                left = Formula.variable(token.text());
                break;
            default:
                throw new SyntaxException(
                        String.format("unexpected token '%s' at %d", token.text(), token.position()),
                        token.position());
        }

        while (index < tokens.size()) {
            Token.Type operator = tokens.get(index).type();
            if (!operator.isBinaryOperator() || operator.precedence() < minimumPrecedence) {
                break;
            }
            Token operatorToken = tokens.get(index);
            index += 1;

            int nextMinimum = operator.isRightAssociative() ? operator.precedence() : operator.precedence() + 1;
            Formula right = parseExpression(nextMinimum, nesting + 1);
            left = Formula.binary(binaryType(operator), left, right);
            checkDepth(left.depth(), operatorToken);
        }
        return left;
    }

    private static void checkDepth(int depth, Token token) throws SyntaxException {
        if (depth > Formula.MAXIMUM_DEPTH) {
            throw new SyntaxException(
                    String.format("formula nested deeper than %d at %d", Formula.MAXIMUM_DEPTH, token.position()),
                    token.position());
        }
    }

    private static Formula.BinaryType binaryType(Token.Type operator) {
        switch (operator) {
            case AND:
                return Formula.BinaryType.AND;
            case OR:
                return Formula.BinaryType.OR;
            case XOR:
                return Formula.BinaryType.XOR;
            case IMPLICATION:
                return Formula.BinaryType.IMPLICATION;
            case EQUIVALENCE:
                return Formula.BinaryType.EQUIVALENCE;
            default:
                throw new IllegalArgumentException("Not a binary operator: " + operator);
        }
    }
}
