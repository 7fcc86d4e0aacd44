package com.sandy.esl.tracker.controller;

import com.sandy.esl.tracker.entity.EslRecord;
import com.sandy.esl.tracker.service.EslRecordService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/esl")
@RequiredArgsConstructor
public class EslController {

    private final EslRecordService eslRecordService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public EslRecord save(@RequestBody EslRecord record) {
        return eslRecordService.save(record);
    }

    @GetMapping("/unprinted")
    public List<EslRecord> findUnprinted(@RequestParam String serial) {
        return eslRecordService.findUnprintedBySerial(serial);
    }

    // start / end: yyyy-MM-dd HH:mm:ss:SSS, both excluded
    @GetMapping
    public List<EslRecord> findByDateRange(@RequestParam String serial,
                                           @RequestParam String start,
                                           @RequestParam String end) {
        return eslRecordService.findByDateRange(serial, start, end);
    }

    @PutMapping("/printed")
    public EslRecord markPrinted(@RequestBody EslRecord record) {
        return eslRecordService.markPrinted(record);
    }

    @PostMapping("/{serial}/print-all")
    public List<EslRecord> printAll(@PathVariable String serial) {
        return eslRecordService.printAll(serial);
    }
}
