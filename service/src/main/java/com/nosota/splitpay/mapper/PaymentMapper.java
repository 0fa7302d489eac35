package com.nosota.splitpay.mapper;

import com.nosota.splitpay.api.dto.PaymentDTO;
import com.nosota.splitpay.model.MemberPayment;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for MemberPayment entity to PaymentDTO conversion.
 */
@Mapper
public interface PaymentMapper {

    PaymentMapper INSTANCE = Mappers.getMapper(PaymentMapper.class);

    PaymentDTO toDTO(MemberPayment payment);

    List<PaymentDTO> toDTOList(List<MemberPayment> payments);
}
