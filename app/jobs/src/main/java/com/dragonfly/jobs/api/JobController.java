/*
 * どこで: Jobs API
 * 何を: ジョブ投入のエンドポイントを提供する
 * なぜ: JVM 外の producer からも封筒検証付きで enqueue できるようにするため
 */
package com.dragonfly.jobs.api;

import com.dragonfly.jobs.model.JobEnvelope;
import com.dragonfly.jobs.service.JobProducer;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/queues")
@RequiredArgsConstructor
@Validated
public class JobController {

    private final JobProducer jobProducer;

    @PostMapping("/{queue}/jobs")
    public ResponseEntity<EnqueueResponse> enqueue(
            @PathVariable("queue")
            @NotBlank(message = "queue is required")
            @Pattern(regexp = "[a-z0-9_]{1,128}", message = "queue must match [a-z0-9_]{1,128}")
            String queueName,
            @RequestBody JobEnvelope envelope) {
        long msgId = jobProducer.enqueue(queueName, envelope);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new EnqueueResponse(queueName, msgId));
    }
}
