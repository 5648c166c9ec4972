package io.attrspans.cli.dto;

/**
 * One step of an {@link EditScript}.
 * <p>
 * Fields used per op:
 *   add / remove / toggle : attribution, start, end
 *   contract              : start, count
 *   push                  : offset
 */
public class EditOperation {
    public String op;
    public AttributionJson attribution;
    public Integer start;
    public Integer end;
    public Integer count;
    public Integer offset;
}
