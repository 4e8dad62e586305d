package com.d2stacks.core.repository;

import com.d2stacks.core.model.MembershipMetadata;
import com.d2stacks.core.result.Result;

public interface MembershipRepository {

    Result<MembershipMetadata, String> getMetadata();
}
