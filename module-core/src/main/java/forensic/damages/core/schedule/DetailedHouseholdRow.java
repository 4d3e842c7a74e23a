package forensic.damages.core.schedule;

public record DetailedHouseholdRow(
    int yearNumber, int calendarYear, double annualValue, double presentValue, double cumulativePv) {}
