package com.evermark.position;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigInteger;

/**
 * Strictly positive net amount an account has delegated to one item.
 */
public record NetDelegation(String itemId, @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger netAmount) {
}
