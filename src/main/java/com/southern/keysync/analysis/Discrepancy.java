package com.southern.keysync.analysis;

import com.southern.keysync.common.enums.DiscrepancyType;
import com.southern.keysync.pojo.dto.SystemKeyRef;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 一条差异，三种类型各有自己的字段
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class Discrepancy {

    private final String normalizedKey;

    protected Discrepancy(String normalizedKey) {
        this.normalizedKey = normalizedKey;
    }

    public abstract DiscrepancyType getType();

    /**
     * 依赖系统有、权威系统没有的键，需要提议主键
     */
    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class OutOfAuthority extends Discrepancy {
        private final List<SystemKeyRef> occurrences;

        public OutOfAuthority(String normalizedKey, List<SystemKeyRef> occurrences) {
            super(normalizedKey);
            this.occurrences = Collections.unmodifiableList(occurrences);
        }

        @Override
        public DiscrepancyType getType() {
            return DiscrepancyType.OUT_OF_AUTHORITY;
        }
    }

    /**
     * 权威系统有、system 没有
     */
    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class PropagationGap extends Discrepancy {
        private final String system;

        public PropagationGap(String system, String normalizedKey) {
            super(normalizedKey);
            this.system = system;
        }

        @Override
        public DiscrepancyType getType() {
            return DiscrepancyType.PROPAGATION_GAP;
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class DuplicateGroup extends Discrepancy {
        private final String system;
        private final Set<String> rawKeys;

        public DuplicateGroup(String system, String normalizedKey, Set<String> rawKeys) {
            super(normalizedKey);
            this.system = system;
            this.rawKeys = Collections.unmodifiableSet(rawKeys);
        }

        @Override
        public DiscrepancyType getType() {
            return DiscrepancyType.DUPLICATE_GROUP;
        }
    }
}
