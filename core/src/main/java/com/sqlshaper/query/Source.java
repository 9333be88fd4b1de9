package com.sqlshaper.query;

/**
 * What a FROM entry or a join reads from.
 */
public sealed interface Source permits TableSource, SubQuerySource, FunctionSource {
}
