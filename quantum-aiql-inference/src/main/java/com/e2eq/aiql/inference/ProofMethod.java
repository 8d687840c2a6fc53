package com.e2eq.aiql.inference;

public enum ProofMethod {
    FORWARD,
    BACKWARD
}
