package com.identityvault.application;

import java.util.List;

public record RecordPage(List<ProtectedRecordView> data, long count) {
}
