package com.example.flowscope.web;

import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

@Controller
public class DashboardPageController {

    @GetMapping("/")
    public String dashboard(Model model) {
        model.addAttribute("wsPath", "/ws");
        return "dashboard";
    }
}
