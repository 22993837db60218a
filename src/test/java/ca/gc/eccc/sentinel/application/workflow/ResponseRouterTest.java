package ca.gc.eccc.sentinel.application.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.eccc.sentinel.domain.alert.ResponseDepartment;
import org.junit.jupiter.api.Test;

class ResponseRouterTest {

  @Test
  void severeEventsGoToEmergencyManagement() {
    assertEquals(ResponseDepartment.EMERGENCY_MANAGEMENT,
        ResponseRouter.route(Fixtures.assessment("Heatwave", "Critical", "Toronto")));
    assertEquals(ResponseDepartment.EMERGENCY_MANAGEMENT,
        ResponseRouter.route(Fixtures.assessment("Flood", "High", "Toronto")));
  }

  @Test
  void floodsAndStormsGoToPublicWorks() {
    assertEquals(ResponseDepartment.PUBLIC_WORKS,
        ResponseRouter.route(Fixtures.assessment("Flash Flood", "Medium", "Toronto")));
    assertEquals(ResponseDepartment.PUBLIC_WORKS,
        ResponseRouter.route(Fixtures.assessment("Severe Storm", "Low", "Toronto")));
  }

  @Test
  void everythingElseGoesToCivilDefense() {
    assertEquals(ResponseDepartment.CIVIL_DEFENSE,
        ResponseRouter.route(Fixtures.assessment("Wildfire", "Medium", "Kelowna")));
  }
}
