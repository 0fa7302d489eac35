package com.nosota.splitpay.mapper;

import com.nosota.splitpay.api.dto.UserSummaryDTO;
import com.nosota.splitpay.dto.UserIdentity;
import com.nosota.splitpay.model.UserAccount;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;
import java.util.Set;

/**
 * MapStruct mapper exposing users without their password hash.
 */
@Mapper
public interface UserAccountMapper {

    UserAccountMapper INSTANCE = Mappers.getMapper(UserAccountMapper.class);

    UserIdentity toIdentity(UserAccount account);

    List<UserIdentity> toIdentityList(List<UserAccount> accounts);

    UserSummaryDTO toSummary(UserIdentity identity);

    /**
     * Roles and groups are sets; responses list them in a stable order.
     */
    default List<String> toSortedList(Set<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().sorted().toList();
    }
}
