package com.devicepush.orchestrator.domain.repository;

import com.devicepush.orchestrator.domain.model.Site;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SiteRepository extends JpaRepository<Site, Long> {

    boolean existsBySiteId(String siteId);
}
