package com.xammer.nodelabeler.controller;

import com.xammer.nodelabeler.dto.NodeStatusDto;
import com.xammer.nodelabeler.exception.NodeNotTrackedException;
import com.xammer.nodelabeler.service.NodeReconciler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/nodes")
public class NodeStatusController {

    private final NodeReconciler reconciler;

    public NodeStatusController(NodeReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @GetMapping
    public List<NodeStatusDto> listNodes() {
        return reconciler.status();
    }

    @GetMapping("/{nodeName}")
    public NodeStatusDto getNode(@PathVariable String nodeName) {
        return reconciler.status(nodeName).orElseThrow(() -> new NodeNotTrackedException(nodeName));
    }
}
