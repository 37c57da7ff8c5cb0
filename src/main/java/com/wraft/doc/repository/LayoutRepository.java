package com.wraft.doc.repository;

import com.wraft.doc.model.Layout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LayoutRepository extends JpaRepository<Layout, Long> {

    Optional<Layout> findByUuid(String uuid);
}
