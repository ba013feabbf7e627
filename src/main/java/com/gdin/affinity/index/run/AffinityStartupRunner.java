package com.gdin.affinity.index.run;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * gdin.affinity.run-on-startup=true 时，应用启动后按配置跑一次完整流水线。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "gdin.affinity", name = "run-on-startup", havingValue = "true")
public class AffinityStartupRunner implements ApplicationRunner {

    @Resource
    private AffinityIndexRunner affinityIndexRunner;

    @Override
    public void run(ApplicationArguments args) {
        AffinityResult result = affinityIndexRunner.runStandard();
        log.info(
                "运行结束：pool={}, clusters={}, assigned={}, missing={}, unassigned={}",
                result.getPool().size(),
                result.getPartition().clusterCount(),
                result.getAssignments().size(),
                result.getMissingIdentifiers().size(),
                result.getUnassignedIdentifiers().size()
        );
    }
}
