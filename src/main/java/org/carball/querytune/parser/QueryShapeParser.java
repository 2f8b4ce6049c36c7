package org.carball.querytune.parser;

import org.carball.querytune.model.query.QueryShape;

/**
 * Turns raw statement text into a {@link QueryShape}. Implementations never throw for malformed text.
 */
public interface QueryShapeParser {

    QueryShape extract(String query);
}
