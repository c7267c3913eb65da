package dev.pekelund.groceries.listparser;

import java.util.Optional;

/**
 * One entry of the ordered matcher table consulted by {@link LineItemParser}.
 */
public interface QuantityMatcher {

    String name();

    Optional<QuantityMatch> tryMatch(String line);
}
