package com.fitcycle.backend.daystatus.dto;

import jakarta.validation.constraints.Size;

/** 空白或 "-" = 清掉備註 */
public record CommentRequest(@Size(max = 500) String note) {}
