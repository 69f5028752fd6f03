package com.pipeline.engine.graph;

import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.WorkflowDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed acyclic graph of a workflow's jobs, with {@code needs} as edges.
 * 
 * Levels are computed with Kahn's algorithm. Within a level jobs keep their
 * declaration order, so the schedule is deterministic.
 */
public final class JobGraph {
    
    private final Map<String, JobDefinition> jobs;
    private final Map<String, Set<String>> dependents;
    private final List<List<String>> levels;
    
    private JobGraph(Map<String, JobDefinition> jobs, Map<String, Set<String>> dependents,
                     List<List<String>> levels) {
        this.jobs = jobs;
        this.dependents = dependents;
        this.levels = levels;
    }
    
    /**
     * Build the graph of a workflow.
     * 
     * @throws ConfigurationException on duplicate ids, undefined {@code needs} or a cycle
     */
    public static JobGraph of(WorkflowDefinition definition) {
        Map<String, JobDefinition> jobs = new LinkedHashMap<>();
        for (JobDefinition job : definition.jobs()) {
            if (job.jobId() == null || job.jobId().isBlank()) {
                throw new ConfigurationException("jobs", "job id cannot be empty");
            }
            if (jobs.put(job.jobId(), job) != null) {
                throw new ConfigurationException("jobs." + job.jobId(), "duplicate job id");
            }
        }
        
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (JobDefinition job : jobs.values()) {
            dependents.putIfAbsent(job.jobId(), new LinkedHashSet<>());
            inDegree.put(job.jobId(), job.needs().size());
            for (String need : job.needs()) {
                if (!jobs.containsKey(need)) {
                    throw new ConfigurationException("jobs." + job.jobId() + ".needs",
                        "references undefined job '" + need + "'");
                }
                if (need.equals(job.jobId())) {
                    throw new ConfigurationException("jobs." + job.jobId() + ".needs",
                        "job depends on itself");
                }
            }
        }
        for (JobDefinition job : jobs.values()) {
            for (String need : job.needs()) {
                dependents.get(need).add(job.jobId());
            }
        }
        
        List<List<String>> levels = new ArrayList<>();
        List<String> current = jobs.keySet().stream().filter(id -> inDegree.get(id) == 0).toList();
        int placed = 0;
        while (!current.isEmpty()) {
            levels.add(current);
            placed += current.size();
            Set<String> next = new LinkedHashSet<>();
            for (String id : current) {
                for (String dependent : dependents.get(id)) {
                    if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            // declaration order within a level
            current = jobs.keySet().stream().filter(next::contains).toList();
        }
        
        if (placed < jobs.size()) {
            List<String> cycle = findCycle(jobs);
            throw new ConfigurationException("jobs", "cyclic needs: " + String.join(" -> ", cycle));
        }
        
        return new JobGraph(Collections.unmodifiableMap(jobs), dependents, List.copyOf(levels));
    }
    
    /**
     * Topological levels: every job's needs lie in earlier levels.
     */
    public List<List<String>> levels() {
        return levels;
    }
    
    public List<String> topologicalOrder() {
        return levels.stream().flatMap(List::stream).toList();
    }
    
    public JobDefinition job(String jobId) {
        return jobs.get(jobId);
    }
    
    public Set<String> dependentsOf(String jobId) {
        return Collections.unmodifiableSet(dependents.getOrDefault(jobId, Set.of()));
    }
    
    /**
     * All jobs reachable through {@code needs} from the given job, excluding itself.
     */
    public Set<String> ancestorsOf(String jobId) {
        Set<String> ancestors = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(jobs.get(jobId).needs());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (ancestors.add(id)) {
                queue.addAll(jobs.get(id).needs());
            }
        }
        return ancestors;
    }
    
    /**
     * All jobs that transitively need the given job.
     */
    public Set<String> descendantsOf(String jobId) {
        Set<String> descendants = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(dependentsOf(jobId));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (descendants.add(id)) {
                queue.addAll(dependentsOf(id));
            }
        }
        return descendants;
    }
    
    public int size() {
        return jobs.size();
    }
    
    // ========== Internal Methods ==========
    
    private static List<String> findCycle(Map<String, JobDefinition> jobs) {
        Set<String> done = new HashSet<>();
        for (String start : jobs.keySet()) {
            List<String> path = new ArrayList<>();
            List<String> cycle = dfs(start, jobs, done, path, new HashSet<>());
            if (cycle != null) {
                return cycle;
            }
        }
        return List.copyOf(jobs.keySet());
    }
    
    private static List<String> dfs(String id, Map<String, JobDefinition> jobs, Set<String> done,
                                    List<String> path, Set<String> onPath) {
        if (onPath.contains(id)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
            cycle.add(id);
            return cycle;
        }
        if (done.contains(id)) {
            return null;
        }
        path.add(id);
        onPath.add(id);
        for (String need : jobs.get(id).needs()) {
            List<String> cycle = dfs(need, jobs, done, path, onPath);
            if (cycle != null) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(id);
        done.add(id);
        return null;
    }
}
