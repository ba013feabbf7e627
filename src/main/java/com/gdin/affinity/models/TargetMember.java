package com.gdin.affinity.models;

import lombok.Builder;
import lombok.Value;

/**
 * 目标人群中的一行：(identifier, group)，identifier 已归一化。
 */
@Value
@Builder
public class TargetMember {
    String identifier;
    String group;
}
