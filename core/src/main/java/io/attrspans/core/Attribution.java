// file: core/src/main/java/io/attrspans/core/Attribution.java
package io.attrspans.core;

/**
 * A label applied to a range of content (bold, a hyperlink, a custom tag).
 * <p>
 * Two separate comparisons are used by the engine:
 *  - {@link #id()}: which "lane" the attribution occupies. Spans in the same
 *    lane can never overlap each other.
 *  - {@link #equals(Object)}: structural equality, used to pair the exact
 *    Start/End markers of one attribution when copying and splicing.
 * <p>
 * Lookups and mutations work on everything in the lane that can merge with
 * the given attribution. Adding to a span held by a mergeable but unequal
 * attribution relabels the merged span with the added one.
 * <p>
 * Implementations must:
 *  - implement equals/hashCode structurally (records do this for free),
 *  - make {@link #canMergeWith(Attribution)} reflexive.
 */
public interface Attribution {

    /**
     * Lane identity. Attributions with the same id share a lane, but only
     * merge with each other when {@link #canMergeWith(Attribution)} allows it.
     */
    String id();

    /**
     * Return true if this attribution can be combined with {@code other} into
     * one continuous span. Returning false for a same-id attribution makes an
     * overlap between the two a conflict.
     */
    boolean canMergeWith(Attribution other);
}
