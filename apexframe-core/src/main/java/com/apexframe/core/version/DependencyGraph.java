package com.apexframe.core.version;

import com.apexframe.core.manifest.DependencySpec;
import com.apexframe.core.manifest.ExtensionManifest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 扩展依赖图
 * 职责：计算启动顺序（依赖在前）、检测循环依赖、查询依赖方
 */
public class DependencyGraph {

    // Key=扩展ID, Value=其依赖的扩展ID（只包含图内节点）
    private final Map<String, List<String>> edges = new LinkedHashMap<>();

    public DependencyGraph(Collection<ExtensionManifest> manifests) {
        Set<String> ids = new LinkedHashSet<>();
        manifests.forEach(m -> ids.add(m.getId()));
        for (ExtensionManifest manifest : manifests) {
            List<String> deps = new ArrayList<>();
            for (DependencySpec dependency : manifest.getDependencies()) {
                if (ids.contains(dependency.pluginId())) {
                    deps.add(dependency.pluginId());
                }
            }
            edges.put(manifest.getId(), deps);
        }
    }

    /**
     * 启动顺序：每个扩展都排在其依赖之后，同层保持注册顺序
     */
    public Ordering startupOrder() {
        List<String> order = new ArrayList<>();
        Set<String> cyclic = new LinkedHashSet<>();
        Map<String, Mark> marks = new LinkedHashMap<>();
        for (String id : edges.keySet()) {
            visit(id, marks, order, cyclic, new ArrayList<>());
        }
        order.removeAll(cyclic);
        return new Ordering(Collections.unmodifiableList(order), Collections.unmodifiableSet(cyclic));
    }

    /**
     * 关闭顺序：启动顺序的逆序，循环成员放在最前
     */
    public List<String> shutdownOrder() {
        Ordering ordering = startupOrder();
        List<String> order = new ArrayList<>(ordering.cyclic());
        List<String> reversed = new ArrayList<>(ordering.order());
        Collections.reverse(reversed);
        order.addAll(reversed);
        return order;
    }

    /**
     * 直接依赖于指定扩展的扩展ID
     */
    public List<String> dependentsOf(String id) {
        List<String> dependents = new ArrayList<>();
        edges.forEach((owner, deps) -> {
            if (deps.contains(id)) {
                dependents.add(owner);
            }
        });
        return dependents;
    }

    private void visit(String id, Map<String, Mark> marks, List<String> order, Set<String> cyclic, List<String> path) {
        Mark mark = marks.get(id);
        if (mark == Mark.DONE) {
            return;
        }
        if (mark == Mark.VISITING) {
            // 从路径中首次出现的位置开始都属于环
            cyclic.addAll(path.subList(path.indexOf(id), path.size()));
            return;
        }
        marks.put(id, Mark.VISITING);
        path.add(id);
        for (String dep : edges.getOrDefault(id, List.of())) {
            visit(dep, marks, order, cyclic, path);
            if (cyclic.contains(dep)) {
                cyclic.add(id);
            }
        }
        path.remove(path.size() - 1);
        marks.put(id, Mark.DONE);
        order.add(id);
    }

    private enum Mark {
        VISITING, DONE
    }

    /**
     * @param order  可启动的顺序
     * @param cyclic 处于循环依赖中（或依赖于循环）的扩展
     */
    public record Ordering(List<String> order, Set<String> cyclic) {
    }
}
