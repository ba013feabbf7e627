package com.gdin.affinity.index.operation;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.affinity.models.Individual;
import com.gdin.affinity.models.InterestPool;
import com.gdin.affinity.models.StudentRecord;
import com.gdin.affinity.models.TargetMember;
import com.gdin.affinity.util.IdentifierUtil;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把目标人群和个体记录合并成 {@link Individual} 列表，并据此计算兴趣池：
 * 所有目标个体兴趣的并集减去排除集合，按字典序排列。
 * <p>
 * 找不到记录的 identifier（MissingRecord）跳过并记录下来，不中止整批计算。
 */
@Slf4j
@Component
public class BuildInterestPoolOperation {

    public Result buildPool(
            Map<String, StudentRecord> records,
            List<TargetMember> members,
            Collection<String> excludedInterests
    ) {
        if (records == null) throw new IllegalArgumentException("records 不能为 null");
        if (members == null) throw new IllegalArgumentException("members 不能为 null");

        // 记录的 key 同样做归一化，保证查找一致
        Map<String, StudentRecord> normalized = new HashMap<>();
        records.forEach((key, record) -> {
            String id = IdentifierUtil.normalize(key);
            if (id != null && record != null) normalized.putIfAbsent(id, record);
        });

        List<Individual> individuals = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Set<String> allInterests = new LinkedHashSet<>();

        for (TargetMember member : members) {
            String id = IdentifierUtil.normalize(member.getIdentifier());
            if (id == null) continue;
            if (!seen.add(id)) {
                log.warn("目标人群中 identifier 重复，忽略后续出现: {}", id);
                continue;
            }

            StudentRecord record = normalized.get(id);
            if (record == null) {
                log.warn("目标人群中的 identifier 没有对应记录，跳过: {}", id);
                missing.add(id);
                continue;
            }

            List<String> interests = IdentifierUtil.cleanInterests(record.getInterests());
            allInterests.addAll(interests);
            individuals.add(Individual.builder()
                    .identifier(id)
                    .firstName(record.getFirstName())
                    .lastName(record.getLastName())
                    .group(member.getGroup())
                    .interests(interests)
                    .build());
        }

        InterestPool pool = new InterestPool(allInterests, excludedInterests);

        log.info(
                "兴趣池构建完成：members={}, individuals={}, missing={}, pool={}, excluded={}",
                members.size(),
                individuals.size(),
                missing.size(),
                pool.size(),
                CollectionUtil.isEmpty(excludedInterests) ? 0 : excludedInterests.size()
        );

        return new Result(pool, List.copyOf(individuals), List.copyOf(missing));
    }

    @Value
    public static class Result {
        InterestPool pool;
        List<Individual> individuals;
        List<String> missingIdentifiers;
    }
}
