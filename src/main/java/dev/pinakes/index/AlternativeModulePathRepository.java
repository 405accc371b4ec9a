package dev.pinakes.index;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link AlternativeModulePath} entities. */
public interface AlternativeModulePathRepository
    extends JpaRepository<AlternativeModulePath, String> {}
