package com.marketchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AccountType {

    BUYER(1, "buyer"),
    SELLER(2, "seller");

    @EnumValue
    private final Integer code;

    private final String desc;
}
