package ideavalidator.domain.specialist;

import java.util.List;

import static ideavalidator.domain.specialist.ClusterDefinition.cluster;
import static ideavalidator.domain.specialist.ClusterDefinition.parameter;
import static ideavalidator.domain.specialist.ClusterDefinition.sub;

/**
 * The static evaluation framework: clusters, their parameters, and the weighted sub-parameters each
 * scored by one specialist. Dependencies name other sub-parameters. A few name a parameter instead,
 * which the planner treats as no dependency.
 */
public final class SpecialistCatalog {
    public static final String CORE_IDEA = "Core Idea";
    public static final String MARKET_OPPORTUNITY = "Market Opportunity";
    public static final String EXECUTION = "Execution";
    public static final String BUSINESS_MODEL = "Business Model";
    public static final String TEAM = "Team";
    public static final String COMPLIANCE = "Compliance";
    public static final String RISK_AND_STRATEGY = "Risk & Strategy";

    private static final List<ClusterDefinition> FRAMEWORK = List.of(
        cluster(CORE_IDEA,
                parameter("Novelty & Uniqueness",
                        sub("Originality", 30, "Innovation Index"),
                        sub("Differentiation", 25, "Market Gap Analysis"),
                        sub("Innovation Index", 25),
                        sub("Disruptive Potential", 20, "Technology Maturity")),
                parameter("Problem-Solution Fit",
                        sub("Problem Severity", 25),
                        sub("Solution Effectiveness", 25, "Technical Feasibility"),
                        sub("Market Gap Analysis", 20, "Market Size (TAM)"),
                        sub("Customer Pain Validation", 15, "User Engagement"),
                        sub("Solution Uniqueness", 15, "Originality")),
                parameter("UX/Usability Potential",
                        sub("Intuitive Design", 30),
                        sub("Accessibility Compliance", 25, "Regulatory Landscape"),
                        sub("User Interface Quality", 20, "Intuitive Design"),
                        sub("Mobile Responsiveness", 15),
                        sub("Cross-Platform Compatibility", 10, "Technical Architecture"))),
        cluster(MARKET_OPPORTUNITY,
                parameter("Market Validation",
                        sub("Market Size (TAM)", 25),
                        sub("Competitive Intensity", 20, "Market Size (TAM)"),
                        sub("Market Growth Rate", 20, "Market Size (TAM)"),
                        sub("Customer Acquisition Potential", 15, "User Engagement"),
                        sub("Market Penetration Strategy", 10, "Cultural Adaptation"),
                        sub("Timing & Market Readiness", 10, "Infrastructure Readiness")),
                parameter("Geographic Specificity (India)",
                        sub("Regulatory Landscape", 25),
                        sub("Infrastructure Readiness", 25),
                        sub("Local Market Understanding", 20, "Cultural Adaptation"),
                        sub("Cultural Adaptation", 15),
                        sub("Regional Expansion Potential", 15, "Infrastructure Readiness")),
                parameter("Product-Market Fit",
                        sub("User Engagement", 20, "Intuitive Design"),
                        sub("Retention Potential", 20, "Product Stickiness"),
                        sub("Customer Satisfaction Metrics", 20, "Solution Effectiveness"),
                        sub("Product Stickiness", 15, "Network Effects"),
                        sub("Market Feedback Integration", 15, "Process Efficiency"),
                        sub("Viral Coefficient", 10, "Network Effects"))),
        cluster(EXECUTION,
                parameter("Technical Feasibility",
                        sub("Technology Maturity", 20),
                        sub("Scalability & Performance", 20, "Technology Maturity"),
                        sub("Technical Architecture", 15, "Technology Maturity"),
                        sub("Development Complexity", 15, "Technical Architecture"),
                        sub("Security Framework", 15, "Data Privacy Compliance"),
                        sub("API Integration Capability", 15, "Technical Architecture")),
                parameter("Operational Viability",
                        sub("Resource Availability", 20),
                        sub("Process Efficiency", 20, "Resource Availability"),
                        sub("Supply Chain Management", 15, "Process Efficiency"),
                        sub("Quality Assurance", 15, "Process Efficiency"),
                        sub("Operational Scalability", 15, "Process Efficiency"),
                        sub("Cost Structure Optimization", 15, "Unit Economics")),
                parameter("Scalability Potential",
                        sub("Business Model Scalability", 20, "Financial Viability"),
                        sub("Market Expansion Potential", 20, "Market Size (TAM)"),
                        sub("Technology Scalability", 15, "Scalability & Performance"),
                        sub("Operational Scalability", 15, "Process Efficiency"),
                        sub("Financial Scalability", 15, "Revenue Stream Diversity"),
                        sub("International Expansion", 15, "Cultural Adaptation"))),
        cluster(BUSINESS_MODEL,
                parameter("Financial Viability",
                        sub("Revenue Stream Diversity", 20),
                        sub("Profitability & Margins", 20, "Unit Economics"),
                        sub("Cash Flow Sustainability", 15, "Revenue Stream Diversity"),
                        sub("Customer Lifetime Value", 15, "Retention Potential"),
                        sub("Unit Economics", 15, "Revenue Stream Diversity"),
                        sub("Financial Projections Accuracy", 15, "Market Size (TAM)")),
                parameter("Defensibility",
                        sub("Intellectual Property (IP)", 20, "Originality"),
                        sub("Network Effects", 20, "User Engagement"),
                        sub("Brand Moat", 15, "Differentiation"),
                        sub("Data Moat", 15, "User Engagement"),
                        sub("Switching Costs", 15, "Product Stickiness"),
                        sub("Regulatory Barriers", 15, "Regulatory Landscape"))),
        cluster(TEAM,
                parameter("Founder-Fit",
                        sub("Relevant Experience", 20),
                        sub("Complementary Skills", 20, "Relevant Experience"),
                        sub("Industry Expertise", 15, "Relevant Experience"),
                        sub("Leadership Capability", 15),
                        sub("Execution Track Record", 15, "Leadership Capability"),
                        sub("Domain Knowledge", 15, "Industry Expertise")),
                parameter("Culture/Values",
                        sub("Mission Alignment", 20),
                        sub("Diversity & Inclusion", 20),
                        sub("Team Dynamics", 15, "Communication Effectiveness"),
                        sub("Communication Effectiveness", 15),
                        sub("Adaptability", 15, "Team Dynamics"),
                        sub("Work Ethics & Values", 15, "Mission Alignment"))),
        cluster(COMPLIANCE,
                parameter("Regulatory (India)",
                        sub("Data Privacy Compliance", 20),
                        sub("Sector-Specific Compliance", 20, "Regulatory Landscape"),
                        sub("Tax Compliance", 15),
                        sub("Labor Law Compliance", 15),
                        sub("Import/Export Regulations", 15, "Regulatory Landscape"),
                        sub("Digital India Compliance", 15, "Infrastructure Readiness")),
                parameter("Sustainability (ESG)",
                        sub("Environmental Impact", 20),
                        sub("Social Impact (SDGs)", 20),
                        sub("Governance Standards", 15, "Ethical Business Practices"),
                        sub("Ethical Business Practices", 15),
                        sub("Community Engagement", 15, "Social Impact (SDGs)"),
                        sub("Carbon Footprint", 15, "Environmental Impact")),
                parameter("Ecosystem Support (India)",
                        sub("Government & Institutional Support", 20, "National Policy Alignment (India)"),
                        sub("Investor & Partner Landscape", 20),
                        sub("Startup Ecosystem Integration", 15, "Investor & Partner Landscape"),
                        sub("Mentorship Availability", 15, "Academic Partnerships"),
                        sub("Industry Associations", 15),
                        sub("Academic Partnerships", 15, "Academic/Research Contribution"))),
        cluster(RISK_AND_STRATEGY,
                parameter("Risk Assessment",
                        sub("Technical Risks", 20, "Development Complexity"),
                        sub("Market Risks", 20, "Competitive Intensity"),
                        sub("Financial Risks", 15, "Cash Flow Sustainability"),
                        sub("Competitive Risks", 15, "Competitive Intensity"),
                        sub("Regulatory Risks", 15, "Regulatory Landscape"),
                        sub("Operational Risks", 15, "Operational Viability")),
                parameter("Investor Attractiveness",
                        sub("Valuation Potential", 20, "Market Size (TAM)"),
                        sub("Exit Strategy Viability", 20, "Market Expansion Potential"),
                        sub("ROI Potential", 15, "Profitability & Margins"),
                        sub("Investment Stage Readiness", 15, "Financial Projections Accuracy"),
                        sub("Due Diligence Preparedness", 15, "Governance Standards"),
                        sub("Investor Fit", 15, "Investor & Partner Landscape")),
                parameter("Academic/National Alignment",
                        sub("National Policy Alignment (India)", 20),
                        sub("Academic/Research Contribution", 20),
                        sub("Innovation Ecosystem Impact", 15, "Academic/Research Contribution"),
                        sub("Knowledge Transfer Potential", 15, "Academic/Research Contribution"),
                        sub("Research Commercialization", 15, "Knowledge Transfer Potential"),
                        sub("Educational Value", 15, "Academic/Research Contribution")))
    );

    private SpecialistCatalog() {
    }

    public static List<ClusterDefinition> framework() {
        return FRAMEWORK;
    }
}
