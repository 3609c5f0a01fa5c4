package com.nosota.assetpay.mapper;

import com.nosota.assetpay.api.dto.AssetTransactionDTO;
import com.nosota.assetpay.model.AssetTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

/**
 * MapStruct mapper for AssetTransaction entity to AssetTransactionDTO conversion.
 */
@Mapper
public interface AssetTransactionMapper {

    AssetTransactionMapper INSTANCE = Mappers.getMapper(AssetTransactionMapper.class);

    AssetTransactionDTO toDTO(AssetTransaction transaction);
}
