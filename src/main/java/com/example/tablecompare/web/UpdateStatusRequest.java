package com.example.tablecompare.web;

import com.example.tablecompare.domain.DifferenceStatus;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class UpdateStatusRequest {
    private DifferenceStatus status;
}
