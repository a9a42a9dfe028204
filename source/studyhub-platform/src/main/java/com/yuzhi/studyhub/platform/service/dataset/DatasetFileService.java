package com.yuzhi.studyhub.platform.service.dataset;

import com.yuzhi.studyhub.common.error.StudyResourceNotFoundException;
import com.yuzhi.studyhub.common.error.StudyValidationException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.StudyPermissions;
import com.yuzhi.studyhub.common.sql.SqlPredicate;
import com.yuzhi.studyhub.platform.repository.RowValues;
import com.yuzhi.studyhub.platform.repository.StudyDataStore;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import com.yuzhi.studyhub.platform.service.security.StudyPredicateContexts;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Dataset file listing and single-file lookup, filtered to the caller's studies and samples.
 * Files without a sample are study-wide and visible to every grant on the study.
 */
@Service
public class DatasetFileService {

    private static final Logger log = LoggerFactory.getLogger(DatasetFileService.class);

    static final String LIST_SQL =
        """
        WITH latest_task_instances AS (
          SELECT DISTINCT ON (task_id)
            task_id,
            title AS task_title,
            summary AS task_summary,
            description AS task_description,
            language_code
          FROM fw_psy_task_instance
          ORDER BY task_id, file_modified DESC
        )
        SELECT
          df.dataset_file_id AS id,
          df.study_id,
          df.task_id,
          ti.task_title,
          ti.task_summary,
          ti.task_description,
          ti.language_code AS task_language,
          df.digest_def_id,
          df.sample_id,
          s.sample_code,
          s.sample_name,
          df.filename,
          df.updated_time
        FROM fw_psy_dataset_file df
        LEFT JOIN latest_task_instances ti ON df.task_id = ti.task_id
        LEFT JOIN fw_psy_sample s ON df.sample_id = s.sample_id
        WHERE {scope}
        ORDER BY df.updated_time DESC
        """;

    static final String FIND_SQL =
        """
        SELECT df.dataset_file_id, df.study_id, df.sample_id, df.filename
        FROM fw_psy_dataset_file df
        WHERE df.dataset_file_id::text = $1
        AND {scope}
        """;

    private final StudyDataStore store;
    private final AccessGate accessGate;
    private final DatasetFileStore fileStore;

    public DatasetFileService(StudyDataStore store, AccessGate accessGate, DatasetFileStore fileStore) {
        this.store = store;
        this.accessGate = accessGate;
        this.fileStore = fileStore;
    }

    /**
     * Visible dataset files, newest first. Sample columns are folded into a {@code sample}
     * object, and each row carries {@code exists}, plus {@code size} and {@code last_modified}
     * when the file is on disk.
     */
    public List<Map<String, Object>> listFiles(Caller caller) {
        accessGate.authorize(caller, StudyPermissions.READ_DATASETS);
        List<Map<String, Object>> rows = accessGate
            .scope(caller, StudyPredicateContexts.DATASET_FILE, 1)
            .map(predicate -> store.execute(LIST_SQL.replace("{scope}", predicate.clauseTemplate()), predicate.params()))
            .orElse(List.of());
        List<Map<String, Object>> files = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            files.add(withFileMetadata(row));
        }
        return files;
    }

    public DatasetDownload openFile(Caller caller, String fileId) {
        accessGate.authorize(caller, StudyPermissions.READ_DATASETS);
        if (StringUtils.isBlank(fileId)) {
            throw new StudyValidationException("Missing file ID");
        }
        Optional<SqlPredicate> scope = accessGate.scope(caller, StudyPredicateContexts.DATASET_FILE, 2);
        if (scope.isEmpty()) {
            throw new StudyResourceNotFoundException("Dataset file not found or access denied");
        }
        SqlPredicate predicate = scope.get();
        List<Object> params = new ArrayList<>();
        params.add(fileId.trim());
        params.addAll(predicate.params());
        List<Map<String, Object>> rows = store.execute(FIND_SQL.replace("{scope}", predicate.clauseTemplate()), params);
        if (rows.isEmpty()) {
            throw new StudyResourceNotFoundException("Dataset file not found or access denied");
        }
        String filename = RowValues.asString(rows.get(0).get("filename"));
        Path path = fileStore
            .resolve(filename)
            .orElseThrow(() -> new StudyResourceNotFoundException("Dataset file not found on disk"));
        log.info("Caller {} downloading dataset file {} ({})", caller.id(), fileId, filename);
        return new DatasetDownload(fileId.trim(), Path.of(filename).getFileName().toString(), path);
    }

    private Map<String, Object> withFileMetadata(Map<String, Object> row) {
        Map<String, Object> file = new LinkedHashMap<>(row);
        Object sampleId = file.remove("sample_id");
        Object sampleCode = file.remove("sample_code");
        Object sampleName = file.remove("sample_name");
        if (sampleId != null) {
            Map<String, Object> sample = new LinkedHashMap<>();
            sample.put("id", sampleId);
            sample.put("code", sampleCode);
            sample.put("name", sampleName);
            file.put("sample", sample);
        } else {
            file.put("sample", null);
        }
        Optional<DatasetFileStore.FileMetadata> metadata = fileStore.stat(RowValues.asString(row.get("filename")));
        file.put("exists", metadata.isPresent());
        metadata.ifPresent(meta -> {
            file.put("size", meta.size());
            file.put("last_modified", meta.lastModified());
        });
        return file;
    }
}
