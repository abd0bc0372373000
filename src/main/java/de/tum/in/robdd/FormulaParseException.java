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

/**
 * Signals that a formula could not be read. The position refers to the formula with all whitespace
 * removed, or is {@code -1} if the input ended prematurely.
 */
public class FormulaParseException extends Exception {
    private static final long serialVersionUID = 1L;

    private final int position;

    public FormulaParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
