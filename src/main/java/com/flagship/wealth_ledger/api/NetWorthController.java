package com.flagship.wealth_ledger.api;

import com.flagship.wealth_ledger.api.dto.NetWorthResponse;
import com.flagship.wealth_ledger.report.NetWorthService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/net-worth")
@RequiredArgsConstructor
public class NetWorthController {

    private final NetWorthService netWorthService;

    @GetMapping
    public NetWorthResponse netWorth() {
        return NetWorthResponse.from(netWorthService.summarize());
    }
}
