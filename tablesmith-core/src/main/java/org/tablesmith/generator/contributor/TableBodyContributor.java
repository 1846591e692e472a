package org.tablesmith.generator.contributor;

/**
 * Marks contributors that write inside the parentheses of CREATE TABLE.
 */
public interface TableBodyContributor {
}
