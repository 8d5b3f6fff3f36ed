package com.cityhunt.progress;

import com.cityhunt.error.ErrorKind;
import com.cityhunt.error.HuntException;
import com.cityhunt.progress.ProgressModels.ProgressRecord;
import com.cityhunt.repository.ProgressJdbcRepository;
import com.cityhunt.repository.ProgressJdbcRepository.ProgressRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Sole write path for group progress. Completions are applied with an
 * optimistic compare-and-swap on the row version and retried on conflict,
 * so concurrent completions for one group all land in the completed set.
 */
@Service
public class ProgressStore {
    private static final Logger log = LoggerFactory.getLogger(ProgressStore.class);

    private final ProgressJdbcRepository repository;
    private final int maxAttempts;

    public ProgressStore(ProgressJdbcRepository repository,
                         @Value("${hunt.progress.max-cas-attempts:32}") int maxAttempts) {
        this.repository = repository;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public ProgressRecord read(String groupId) {
        return repository.find(groupId)
                .map(ProgressStore::toRecord)
                .orElseGet(ProgressRecord::zero);
    }

    public ProgressRecord applyCompletion(String groupId, int stageNumber) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<ProgressRow> current = repository.find(groupId);

            TreeSet<Integer> completed = new TreeSet<>(current.map(ProgressRow::completedStages).orElse(List.of()));
            completed.add(stageNumber);
            int highest = Math.max(current.map(ProgressRow::currentStage).orElse(0), stageNumber);
            long expectedVersion = current.map(ProgressRow::version).orElse(0L);
            ProgressRow next = new ProgressRow(groupId, highest, List.copyOf(completed), expectedVersion + 1, Instant.now());

            boolean written = current.isEmpty()
                    ? repository.insertInitial(next)
                    : repository.compareAndSet(next, expectedVersion);
            if (written) {
                return toRecord(next);
            }
            log.debug("Progress write conflict for group {} at version {}, attempt {}", groupId, expectedVersion, attempt);
        }
        throw new HuntException(ErrorKind.INTERNAL,
                "Progress update for group " + groupId + " did not settle after " + maxAttempts + " attempts");
    }

    private static ProgressRecord toRecord(ProgressRow row) {
        return new ProgressRecord(row.currentStage(), row.completedStages(), row.lastUpdated());
    }
}
