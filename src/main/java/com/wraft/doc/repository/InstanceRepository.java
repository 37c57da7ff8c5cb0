package com.wraft.doc.repository;

import com.wraft.doc.model.Instance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface InstanceRepository extends JpaRepository<Instance, Long> {

    Optional<Instance> findByUuid(String uuid);

    /**
     * All instances of a content type, newest first.
     */
    @Query("SELECT i FROM Instance i JOIN i.contentType ct WHERE ct.uuid = :contentTypeUuid ORDER BY i.id DESC")
    List<Instance> findByContentTypeUuid(@Param("contentTypeUuid") String contentTypeUuid);
}
