package com.nursery.service;

import com.nursery.model.DashboardStats;
import com.nursery.model.RecordKind;
import com.nursery.repository.NurseryRecordRepository;
import org.springframework.stereotype.Service;

/**
 * Recomputes an owner's dashboard from the stored quantities on every call.
 * Delivery notes and distributed seedlings do not contribute.
 */
@Service
public class DashboardService {

    private final NurseryRecordRepository recordRepository;

    public DashboardService(NurseryRecordRepository recordRepository) {
        this.recordRepository = recordRepository;
    }

    public DashboardStats getStats(String ownerId) {
        return DashboardStats.of(
            recordRepository.sumQuantity(RecordKind.SEEDLINGS_RECEIVED, ownerId),
            recordRepository.sumQuantity(RecordKind.DEAD_SEEDLINGS, ownerId),
            recordRepository.sumQuantity(RecordKind.DISCARDED_SEEDLINGS, ownerId),
            recordRepository.sumQuantity(RecordKind.NURSERY_PRODUCED, ownerId)
        );
    }
}
