package com.cascade.model;

/**
 * Either a literal value or a reference to a field of a work item.
 */
public sealed interface Operand permits ConstOperand, ObjectOperand {
}
