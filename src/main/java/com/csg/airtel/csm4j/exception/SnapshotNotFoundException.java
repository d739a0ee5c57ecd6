package com.csg.airtel.csm4j.exception;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

public class SnapshotNotFoundException extends BaseException {

    public SnapshotNotFoundException(String sessionId, String snapshotId) {
        super("Snapshot " + snapshotId + " not found for session " + sessionId,
                ResponseCodeEnum.SNAPSHOT_NOT_FOUND.description(),
                Response.Status.NOT_FOUND,
                ResponseCodeEnum.SNAPSHOT_NOT_FOUND.code());
    }
}
