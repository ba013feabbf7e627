package com.gdin.affinity.models;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 兴趣池：目标人群所有兴趣的并集减去排除集合，按字典序排列，构造后不可变。
 * 标签在池中的下标即图节点编号。
 */
public final class InterestPool {

    @Getter
    private final List<String> tags;

    @Getter
    private final Set<String> excluded;

    private final Map<String, Integer> indexByTag;

    public InterestPool(Collection<String> tags, Collection<String> excluded) {
        Set<String> excludedSet = excluded == null ? Set.of() : new LinkedHashSet<>(excluded);
        TreeSet<String> sorted = new TreeSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !excludedSet.contains(tag)) sorted.add(tag);
            }
        }
        this.tags = List.copyOf(sorted);
        this.excluded = Collections.unmodifiableSet(excludedSet);

        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.tags.size(); i++) {
            idx.put(this.tags.get(i), i);
        }
        this.indexByTag = Collections.unmodifiableMap(idx);
    }

    public static InterestPool empty() {
        return new InterestPool(List.of(), List.of());
    }

    public int size() {
        return tags.size();
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public boolean contains(String tag) {
        return tag != null && indexByTag.containsKey(tag);
    }

    /** 不在池中返回 -1 */
    public int indexOf(String tag) {
        Integer i = tag == null ? null : indexByTag.get(tag);
        return i == null ? -1 : i;
    }

    /**
     * 只保留池内兴趣，去重并保持输入顺序。
     */
    public List<String> restrict(Collection<String> interests) {
        if (interests == null || interests.isEmpty()) return List.of();
        Set<String> kept = new LinkedHashSet<>();
        for (String interest : interests) {
            if (contains(interest)) kept.add(interest);
        }
        return new ArrayList<>(kept);
    }

    @Override
    public String toString() {
        return "InterestPool" + tags;
    }
}
