package com.tradeguard.mapper;

import com.tradeguard.domain.model.Order;
import com.tradeguard.entity.OrderEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between the Order domain model and OrderEntity. */
@Mapper
public interface OrderMapper {

    OrderEntity toEntity(Order order);

    Order toDomain(OrderEntity entity);

    List<Order> toDomainList(List<OrderEntity> entities);
}
