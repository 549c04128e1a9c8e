package com.quikdb.api.node;

import java.math.BigInteger;

public record NodeInfo(String nodeId, NodeStatus status, String operator, BigInteger capacity) {}
