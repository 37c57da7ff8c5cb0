package com.wraft.doc.repository;

import com.wraft.doc.model.BuildHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the build log. Rows are only ever inserted.
 */
@Repository
public interface BuildHistoryRepository extends JpaRepository<BuildHistory, Long> {

    /**
     * Most recent build of an instance that exited with the given code.
     * Used with exit code 0 to decide whether a download link exists.
     */
    Optional<BuildHistory> findFirstByContentIdAndExitCodeOrderByInsertedAtDescIdDesc(Long contentId, int exitCode);

    List<BuildHistory> findByContentIdOrderByInsertedAtDescIdDesc(Long contentId);

    long countByContentId(Long contentId);
}
