package com.gameday.leaguedata.dto;

import com.gameday.leaguedata.model.StandingsRow;
import com.gameday.leaguedata.model.Team;

public class StandingsEntryDTO {
    private int position; // across all chunks of the division
    private String teamFullName;
    private String teamName; // null when the team sheet has no matching row
    private String teamCity;
    private String teamAbbreviation;
    private String teamColor;
    private int gp;
    private int w;
    private int otw;
    private int otl;
    private int l;
    private int pts;
    private int diff;
    private double pct;
    private int gf;
    private int ga;

    public StandingsEntryDTO() {}

    public StandingsEntryDTO(int position, StandingsRow row, Team team) {
        this.position = position;
        this.teamFullName = row.teamFullName();
        if (team != null) {
            this.teamName = team.name();
            this.teamCity = team.city();
            this.teamAbbreviation = team.abbreviation();
            this.teamColor = team.color1();
        }
        this.gp = row.gamesPlayed();
        this.w = row.wins();
        this.otw = row.overtimeWins();
        this.otl = row.overtimeLosses();
        this.l = row.losses();
        this.pts = row.points();
        this.diff = row.goalDifferential();
        this.pct = row.winPercentage();
        this.gf = row.goalsFor();
        this.ga = row.goalsAgainst();
    }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public String getTeamFullName() { return teamFullName; }
    public void setTeamFullName(String teamFullName) { this.teamFullName = teamFullName; }

    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }

    public String getTeamCity() { return teamCity; }
    public void setTeamCity(String teamCity) { this.teamCity = teamCity; }

    public String getTeamAbbreviation() { return teamAbbreviation; }
    public void setTeamAbbreviation(String teamAbbreviation) { this.teamAbbreviation = teamAbbreviation; }

    public String getTeamColor() { return teamColor; }
    public void setTeamColor(String teamColor) { this.teamColor = teamColor; }

    public int getGp() { return gp; }
    public void setGp(int gp) { this.gp = gp; }

    public int getW() { return w; }
    public void setW(int w) { this.w = w; }

    public int getOtw() { return otw; }
    public void setOtw(int otw) { this.otw = otw; }

    public int getOtl() { return otl; }
    public void setOtl(int otl) { this.otl = otl; }

    public int getL() { return l; }
    public void setL(int l) { this.l = l; }

    public int getPts() { return pts; }
    public void setPts(int pts) { this.pts = pts; }

    public int getDiff() { return diff; }
    public void setDiff(int diff) { this.diff = diff; }

    public double getPct() { return pct; }
    public void setPct(double pct) { this.pct = pct; }

    public int getGf() { return gf; }
    public void setGf(int gf) { this.gf = gf; }

    public int getGa() { return ga; }
    public void setGa(int ga) { this.ga = ga; }
}
