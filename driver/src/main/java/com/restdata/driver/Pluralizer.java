/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

/**
 * Converts resource names between their singular and plural forms, for
 * services whose entity sets are named after the plural of the entity
 * type. The driver does not apply any naming rules of its own;
 * {@link #NONE} leaves names unchanged.
 */
public interface Pluralizer {

    /**
     * A pluralizer that returns every word unchanged.
     */
    Pluralizer NONE = new Pluralizer() {
        @Override
        public String pluralize(String word) {
            return word;
        }

        @Override
        public String singularize(String word) {
            return word;
        }

        @Override
        public String toString() {
            return "Pluralizer.NONE";
        }
    };

    /**
     * @param word a singular word
     * @return its plural form
     */
    String pluralize(String word);

    /**
     * @param word a plural word
     * @return its singular form
     */
    String singularize(String word);
}
