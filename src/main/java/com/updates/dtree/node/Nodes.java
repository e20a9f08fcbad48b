package com.updates.dtree.node;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.ScalarValues;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named factories for the decisions an update server typically makes.
 *
 * Each one is a thin wrapper over a generic variant with the conventional
 * query field name filled in.
 */
public final class Nodes {
    private Nodes() {
        // Utility class
    }

    public static final String PRODUCT = "product";
    public static final String VERSION = "version";
    public static final String OS = "os";
    public static final String CPU_ARCH = "cpuarch";
    public static final String OS_ARCH = "osarch";
    public static final String LOCALE = "locale";

    public static TerminalNode outcome(Object value) {
        return new TerminalNode(value);
    }

    public static EqualsBranchNode product(String product, NodeId success, NodeId failure) {
        return new EqualsBranchNode(PRODUCT, product, success, failure);
    }

    public static EqualsBranchNode versionExact(String version, NodeId success, NodeId failure) {
        return new EqualsBranchNode(VERSION, version, success, failure);
    }

    public static OrderedCutoffNode versionCutoff(String cutoff, NodeId less, NodeId greaterOrEqual) {
        return new OrderedCutoffNode(VERSION, cutoff, less, greaterOrEqual);
    }

    /** Windows and Linux get their own branch; anything else goes to {@code other}. */
    public static EnumeratedNode operatingSystem(NodeId windows, NodeId linux, NodeId other) {
        Map<Object, NodeId> cases = new LinkedHashMap<>();
        cases.put("windows", windows);
        cases.put("linux", linux);
        return new EnumeratedNode(OS, cases, other);
    }

    /** 32-bit processors go to {@code node32}, everything else to {@code node64}. */
    public static EqualsBranchNode cpuArchitecture(NodeId node32, NodeId node64) {
        return new EqualsBranchNode(CPU_ARCH, 32L, node32, node64);
    }

    /** 32-bit operating systems go to {@code node32}, everything else to {@code node64}. */
    public static EqualsBranchNode osArchitecture(NodeId node32, NodeId node64) {
        return new EqualsBranchNode(OS_ARCH, 32L, node32, node64);
    }

    public static SetMembershipNode locale(Collection<String> locales, NodeId in, NodeId notIn) {
        return new SetMembershipNode(LOCALE, ScalarValues.sortedSet(locales), in, notIn);
    }

    /** Escape hatch for one-off flags on arbitrary fields. */
    public static EqualsBranchNode arbitrary(String key, Object value, NodeId success, NodeId failure) {
        return new EqualsBranchNode(key, value, success, failure);
    }

    public static ProbabilisticNode rollout(double threshold, NodeId inside, NodeId outside) {
        return new ProbabilisticNode(threshold, inside, outside);
    }
}
