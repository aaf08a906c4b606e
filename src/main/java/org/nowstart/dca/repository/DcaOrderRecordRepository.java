package org.nowstart.dca.repository;

import java.util.List;
import org.nowstart.dca.data.entity.DcaOrderRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DcaOrderRecordRepository extends JpaRepository<DcaOrderRecord, Long> {

    List<DcaOrderRecord> findAllByOrderByOrderedAtAsc();
}
