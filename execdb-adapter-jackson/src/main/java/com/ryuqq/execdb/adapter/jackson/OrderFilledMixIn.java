package com.ryuqq.execdb.adapter.jackson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 파생 값(fullFill)은 저장하지 않습니다.
 */
@JsonIgnoreProperties({"fullFill"})
abstract class OrderFilledMixIn {
}
