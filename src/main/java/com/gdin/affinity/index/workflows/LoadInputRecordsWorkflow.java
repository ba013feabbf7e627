package com.gdin.affinity.index.workflows;

import com.gdin.affinity.models.StudentRecord;
import com.gdin.affinity.models.TargetMember;
import com.gdin.affinity.storage.StudentDataLoader;
import com.gdin.affinity.storage.TargetPoolReader;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 输出（写回 context.state）：
 * - student_records
 * - target_members
 */
@Slf4j
@Service
public class LoadInputRecordsWorkflow {

    @Resource
    private StudentDataLoader studentDataLoader;

    @Resource
    private TargetPoolReader targetPoolReader;

    public Result run(
            String studentDataPath,
            String targetPoolPath,
            String identifierColumn,
            String groupColumn
    ) {
        log.info("开始加载输入：studentDataPath={}, targetPoolPath={}", studentDataPath, targetPoolPath);

        Map<String, StudentRecord> records = studentDataLoader.load(studentDataPath);
        List<TargetMember> members = targetPoolReader.read(targetPoolPath, identifierColumn, groupColumn);
        return new Result(records, members);
    }

    @Value
    public static class Result {
        Map<String, StudentRecord> records;
        List<TargetMember> members;
    }
}
