package com.face.matching.job;

import com.face.matching.exception.DuplicateJobException;
import com.face.matching.exception.InvalidTransitionException;
import com.face.matching.exception.JobNotFoundException;
import com.face.matching.model.JobStatus;
import com.face.matching.model.JobView;
import com.face.matching.model.Summary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程内任务表
 * 每个任务保存不可变快照，状态迁移通过compute原子替换，读取方不会看到中间状态。
 * 允许的迁移：QUEUED→RUNNING，RUNNING→DONE，RUNNING→ERROR
 */
public class JobRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(JobRegistry.class);

    private final ConcurrentMap<String, JobView> jobs = new ConcurrentHashMap<>();

    public void create(String jobId) {
        create(jobId, null);
    }

    /**
     * 新建任务，状态为QUEUED
     */
    public void create(String jobId, String outputDirectory) {
        JobView view = JobView.builder()
                .jobId(jobId)
                .status(JobStatus.QUEUED)
                .outputDirectory(outputDirectory)
                .build();
        if (jobs.putIfAbsent(jobId, view) != null) {
            throw new DuplicateJobException(jobId);
        }
        LOG.debug("Job created: {}", jobId);
    }

    /**
     * 原子地更新任务状态和负载
     *
     * @param summary       DONE时的结果
     * @param errorMessage  ERROR时的错误信息
     */
    public JobView transition(String jobId, JobStatus newStatus, Summary summary, String errorMessage) {
        JobView updated = jobs.compute(jobId, (id, current) -> {
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            if (!current.getStatus().canTransitionTo(newStatus)) {
                throw new InvalidTransitionException(id, current.getStatus(), newStatus);
            }
            return current.toBuilder()
                    .status(newStatus)
                    .summary(summary)
                    .error(errorMessage)
                    .build();
        });
        LOG.debug("Job {} -> {}", jobId, newStatus);
        return updated;
    }

    public JobView markRunning(String jobId) {
        return transition(jobId, JobStatus.RUNNING, null, null);
    }

    public JobView markDone(String jobId, Summary summary) {
        return transition(jobId, JobStatus.DONE, summary, null);
    }

    public JobView markError(String jobId, String errorMessage) {
        return transition(jobId, JobStatus.ERROR, null, errorMessage);
    }

    /**
     * 获取任务快照
     */
    public JobView get(String jobId) {
        JobView view = jobs.get(jobId);
        if (view == null) {
            throw new JobNotFoundException(jobId);
        }
        return view;
    }

    /**
     * 未结束任务的输出目录
     */
    public Set<String> activeOutputDirectories() {
        Set<String> result = new HashSet<>();
        for (JobView view : jobs.values()) {
            if (!view.getStatus().isTerminal() && view.getOutputDirectory() != null) {
                result.add(view.getOutputDirectory());
            }
        }
        return result;
    }

    /**
     * 所有任务的当前快照
     */
    public List<JobView> snapshot() {
        return new ArrayList<>(jobs.values());
    }

    /**
     * 移除输出目录为outputDirectory的已结束任务，运行中的任务不受影响
     *
     * @return 移除的任务数
     */
    public int evictFinished(String outputDirectory) {
        int evicted = 0;
        for (Map.Entry<String, JobView> entry : jobs.entrySet()) {
            JobView view = entry.getValue();
            if (view.getStatus().isTerminal()
                    && outputDirectory.equals(view.getOutputDirectory())
                    && jobs.remove(entry.getKey(), view)) {
                evicted++;
                LOG.debug("Job {} evicted after output cleanup", entry.getKey());
            }
        }
        return evicted;
    }

    public boolean contains(String jobId) {
        return jobs.containsKey(jobId);
    }

    public int size() {
        return jobs.size();
    }
}
