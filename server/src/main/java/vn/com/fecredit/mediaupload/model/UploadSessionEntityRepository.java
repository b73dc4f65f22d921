package vn.com.fecredit.mediaupload.model;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface UploadSessionEntityRepository extends JpaRepository<UploadSessionEntity, String> {

    /**
     * Finds sessions in one of the given statuses whose last activity is strictly before the cutoff.
     *
     * @param statuses statuses to match
     * @param cutoff   exclusive upper bound for {@code lastActivityAt}
     * @return matching sessions
     */
    List<UploadSessionEntity> findByStatusInAndLastActivityAtBefore(Collection<SessionStatus> statuses, Instant cutoff);

    /**
     * Finds sessions in one of the given statuses that last changed strictly before the cutoff.
     */
    List<UploadSessionEntity> findByStatusInAndUpdatedAtBefore(Collection<SessionStatus> statuses, Instant cutoff);
}
