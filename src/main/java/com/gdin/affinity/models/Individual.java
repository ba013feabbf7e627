package com.gdin.affinity.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 记录与目标人群合并之后的个体。interests 为原始兴趣（已清洗去重），可能包含兴趣池之外的标签。
 */
@Value
@Builder
public class Individual {
    String identifier;
    String firstName;
    String lastName;
    String group;
    List<String> interests;
}
