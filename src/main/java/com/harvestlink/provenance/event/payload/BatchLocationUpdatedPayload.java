package com.harvestlink.provenance.event.payload;

public record BatchLocationUpdatedPayload(long batchId, String location, String updatedBy) implements EventPayload {

    @Override
    public boolean concernsBatch(long id) {
        return batchId == id;
    }
}
